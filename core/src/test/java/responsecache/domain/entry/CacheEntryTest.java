package responsecache.domain.entry;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import responsecache.domain.exceptions.CacheValidationFailed;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CacheEntryTest {

    private static CacheEntry example() {
        return CacheEntry.builder()
                .model("gpt-3.5-turbo")
                .parameters(Map.of("temperature", 0.5))
                .systemPrompt("The quick brown fox jumps over the lazy dog.")
                .userPrompt("What does the fox say?")
                .output("The fox says 'hello'")
                .iteration(1)
                .timestamp(1_700_000_000L)
                .service("openai")
                .build();
    }

    @Test
    public void testDefaults() {
        final CacheEntry entry = CacheEntry.builder()
                .model("model")
                .parameters(Map.of())
                .systemPrompt("system")
                .userPrompt("user")
                .output("\"output\"")
                .build();

        Assertions.assertEquals(0, entry.iteration());
        Assertions.assertNull(entry.service());
        Assertions.assertTrue(entry.timestamp() > 0);
    }

    @Test
    public void testRoundTrip() {
        final CacheEntry entry = example();
        final CacheEntry copy = CacheEntry.fromMap(entry.toMap());

        Assertions.assertEquals(entry, copy);
        Assertions.assertEquals(entry.timestamp(), copy.timestamp());
        Assertions.assertEquals(entry.key(), copy.key());
    }

    @Test
    public void testToMapFieldOrder() {
        Assertions.assertEquals(CacheEntry.FIELDS, List.copyOf(example().toMap().keySet()));
    }

    @Test
    public void testEqualityIgnoresTimestamp() {
        final CacheEntry entry = example();
        final CacheEntry later = entry.withTimestamp(entry.timestamp() + 1000);

        Assertions.assertEquals(entry, later);
        Assertions.assertEquals(entry.hashCode(), later.hashCode());
    }

    @Test
    public void testDifferentOutputIsNotEqual() {
        final CacheEntry entry = example();
        final Map<String, Object> data = new LinkedHashMap<>(entry.toMap());
        data.put("output", "something else");
        final CacheEntry other = CacheEntry.fromMap(data);

        Assertions.assertNotEquals(entry, other);
        Assertions.assertEquals(entry.key(), other.key());
    }

    @Test
    public void testMissingIterationAndTimestampUseDefaults() {
        final Map<String, Object> data = new LinkedHashMap<>(example().toMap());
        data.remove("iteration");
        data.remove("timestamp");

        final CacheEntry entry = CacheEntry.fromMap(data);
        Assertions.assertEquals(0, entry.iteration());
        Assertions.assertTrue(entry.timestamp() > 0);
    }

    @Test
    public void testWrongTypesAreRejected() {
        final Map<String, Object> badModel = new LinkedHashMap<>(example().toMap());
        badModel.put("model", 1);
        Assertions.assertThrows(CacheValidationFailed.class, () -> CacheEntry.fromMap(badModel));

        final Map<String, Object> badParameters = new LinkedHashMap<>(example().toMap());
        badParameters.put("parameters", "temperature=0.5");
        Assertions.assertThrows(CacheValidationFailed.class, () -> CacheEntry.fromMap(badParameters));

        final Map<String, Object> badIteration = new LinkedHashMap<>(example().toMap());
        badIteration.put("iteration", "1");
        Assertions.assertThrows(CacheValidationFailed.class, () -> CacheEntry.fromMap(badIteration));

        final Map<String, Object> badService = new LinkedHashMap<>(example().toMap());
        badService.put("service", 42);
        Assertions.assertThrows(CacheValidationFailed.class, () -> CacheEntry.fromMap(badService));
    }

    @Test
    public void testUnknownAndMissingFieldsAreRejected() {
        final Map<String, Object> unknown = new LinkedHashMap<>(example().toMap());
        unknown.put("colour", "blue");
        Assertions.assertThrows(CacheValidationFailed.class, () -> CacheEntry.fromMap(unknown));

        final Map<String, Object> missing = new LinkedHashMap<>(example().toMap());
        missing.remove("user_prompt");
        Assertions.assertThrows(CacheValidationFailed.class, () -> CacheEntry.fromMap(missing));
    }

    @Test
    public void testBuilderRejectsNulls() {
        Assertions.assertThrows(CacheValidationFailed.class, () -> CacheEntry.builder()
                .model("model")
                .parameters(Map.of())
                .systemPrompt("system")
                .output("output")
                .build());
    }

    @Test
    public void testParametersAreCopied() {
        final Map<String, Object> parameters = new HashMap<>();
        parameters.put("temperature", 0.5);

        final CacheEntry entry = CacheEntry.builder()
                .model("model")
                .parameters(parameters)
                .systemPrompt("system")
                .userPrompt("user")
                .output("output")
                .build();
        parameters.put("temperature", 1.0);

        Assertions.assertEquals(0.5, entry.parameters().get("temperature"));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> entry.parameters().put("top_p", 1));
    }

    @Test
    public void testParametersCompareByCanonicalForm() {
        final CacheEntry wide = CacheEntry.builder()
                .model("model")
                .parameters(Map.of("max_tokens", 100L, "temperature", 0.5f))
                .systemPrompt("S")
                .userPrompt("U")
                .output("answer")
                .build();
        final CacheEntry reloaded = CacheEntry.fromMap(new LinkedHashMap<>(Map.of(
                "model", "model",
                "parameters", Map.of("max_tokens", 100, "temperature", 0.5),
                "system_prompt", "S",
                "user_prompt", "U",
                "output", "answer")));

        Assertions.assertEquals(wide.key(), reloaded.key());
        Assertions.assertEquals(wide, reloaded);
        Assertions.assertEquals(wide.hashCode(), reloaded.hashCode());
    }

    @Test
    public void testIterationOutOfRangeIsRejected() {
        final Map<String, Object> data = new LinkedHashMap<>(example().toMap());
        data.put("iteration", Long.MAX_VALUE);
        Assertions.assertThrows(CacheValidationFailed.class, () -> CacheEntry.fromMap(data));
    }
}
