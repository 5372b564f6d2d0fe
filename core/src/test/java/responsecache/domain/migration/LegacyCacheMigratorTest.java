package responsecache.domain.migration;

import jakarta.inject.Inject;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import responsecache.domain.cache.Cache;
import responsecache.domain.entry.CacheEntry;
import responsecache.domain.exceptions.CacheFileNotFound;
import responsecache.domain.exceptions.CacheValidationFailed;
import responsecache.domain.logger.Loggers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@EnableAutoWeld
@AddBeanClasses(LegacyCacheMigrator.class)
@AddBeanClasses(Loggers.class)
public class LegacyCacheMigratorTest {

    @Inject
    LegacyCacheMigrator legacyCacheMigrator;

    @TempDir
    Path tempDir;

    @Test
    public void testMigrate() throws Exception {
        final Path legacy = tempDir.resolve("responses.db");
        LegacyCacheFixture.create(legacy, new String[]{"1", "m", "{'t': 0}", "s", "u", "o"});

        final Cache cache = new Cache();
        final int count = legacyCacheMigrator.migrate(legacy, cache);

        Assertions.assertEquals(1, count);
        Assertions.assertEquals(1, cache.size());

        final CacheEntry entry = cache.values().get(0);
        Assertions.assertEquals("m", entry.model());
        Assertions.assertEquals(Map.of("t", 0), entry.parameters());
        Assertions.assertEquals("s", entry.systemPrompt());
        Assertions.assertEquals("u", entry.userPrompt());
        Assertions.assertEquals("o", entry.output());
        Assertions.assertEquals(0, entry.iteration());
        Assertions.assertEquals(entry.key(), cache.keys().get(0));

        Assertions.assertFalse(Files.exists(legacy));
        Assertions.assertTrue(Files.exists(tempDir.resolve("responses.db.bak")));
    }

    @Test
    public void testMigratedKeyMatchesNewEntries() throws Exception {
        final Path legacy = tempDir.resolve("responses.db");
        LegacyCacheFixture.create(legacy, new String[]{"1", "gpt-3.5-turbo", "{'temperature': 0.5}", "S", "U", "{\"k\": \"v\"}"});

        final Cache cache = new Cache();
        legacyCacheMigrator.migrate(legacy, cache);

        Assertions.assertEquals(
                "{\"k\": \"v\"}",
                cache.fetch("gpt-3.5-turbo", Map.of("temperature", 0.5), "S", "U", 0).output());
    }

    @Test
    public void testMissingFile() {
        Assertions.assertThrows(CacheFileNotFound.class,
                () -> legacyCacheMigrator.migrate(tempDir.resolve("missing.db"), new Cache()));
    }

    @Test
    public void testMalformedParametersLeaveTheFileInPlace() throws Exception {
        final Path legacy = tempDir.resolve("responses.db");
        LegacyCacheFixture.create(legacy, new String[]{"1", "m", "{'t': ", "s", "u", "o"});

        final Cache cache = new Cache();
        Assertions.assertThrows(CacheValidationFailed.class, () -> legacyCacheMigrator.migrate(legacy, cache));

        Assertions.assertTrue(Files.exists(legacy));
        Assertions.assertEquals(0, cache.size());
    }
}
