package responsecache.domain.entry;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CacheKeyTest {

    @Test
    public void testKnownKey() {
        Assertions.assertEquals(
                "b4597db6279c3ab12e4076289d4288d1",
                CacheKey.generate("gpt-3.5-turbo", Map.of("temperature", 0.5), "S", "U", 0));
    }

    @Test
    public void testKnownKeyWithNestedAndNonAsciiValues() {
        final Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("temperature", 0.5);
        parameters.put("max_tokens", 100);
        parameters.put("stop", List.of("\n"));

        Assertions.assertEquals(
                "fc3a2c3c5378837c5fa3859fe2fa9c20",
                CacheKey.generate("gpt-4", parameters, "You are helpful", "Hi é", 2));
    }

    @Test
    public void testParameterOrderIsIgnored() {
        final Map<String, Object> first = new LinkedHashMap<>();
        first.put("temperature", 0.5);
        first.put("max_tokens", 100);
        first.put("top_p", 1.0);

        final Map<String, Object> second = new LinkedHashMap<>();
        second.put("top_p", 1.0);
        second.put("max_tokens", 100);
        second.put("temperature", 0.5);

        Assertions.assertEquals(
                CacheKey.generate("model", first, "system", "user", 0),
                CacheKey.generate("model", second, "system", "user", 0));
    }

    @Test
    public void testDeterministic() {
        final Map<String, Object> parameters = Map.of("temperature", 0.7);
        Assertions.assertEquals(
                CacheKey.generate("model", parameters, "system", "user", 1),
                CacheKey.generate("model", parameters, "system", "user", 1));
    }

    @Test
    public void testIterationChangesKey() {
        final Map<String, Object> parameters = Map.of("temperature", 0.7);
        Assertions.assertNotEquals(
                CacheKey.generate("model", parameters, "system", "user", 0),
                CacheKey.generate("model", parameters, "system", "user", 1));
    }

    @Test
    public void testKeyIsHex() {
        final String key = CacheKey.generate("model", Map.of(), "", "", 0);
        Assertions.assertTrue(key.matches("[0-9a-f]{32}"));
    }
}
