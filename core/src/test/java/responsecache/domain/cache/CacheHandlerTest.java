package responsecache.domain.cache;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import responsecache.domain.entry.CacheEntry;
import responsecache.domain.exceptionhandling.LoggingExceptionHandler;
import responsecache.domain.logger.Loggers;
import responsecache.domain.migration.LegacyCacheFixture;
import responsecache.domain.migration.LegacyCacheMigrator;
import responsecache.domain.persist.SqliteBackingStore;
import responsecache.domain.persist.config.CacheDatabasePath;
import responsecache.domain.persist.config.LegacyCacheDatabasePath;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(CacheHandler.class)
@AddBeanClasses(CacheDatabasePath.class)
@AddBeanClasses(LegacyCacheDatabasePath.class)
@AddBeanClasses(LegacyCacheMigrator.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
public class CacheHandlerTest {

    @Inject
    CacheHandler cacheHandler;

    @TempDir
    Path tempDir;

    /**
     * <a href="https://github.com/weld/weld-testing/issues/81#issuecomment-1564002983">...</a>
     */
    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of(
                        "rc.cache.path", tempDir.resolve("cache/data.db").toString(),
                        "rc.cache.legacypath", tempDir.resolve("cache/responses.db").toString()),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    public void testDefaultCache() {
        final Cache cache = cacheHandler.getCache();

        Assertions.assertSame(cache, cacheHandler.getCache());
        Assertions.assertTrue(cache.getBackingStore() instanceof SqliteBackingStore);
        Assertions.assertTrue(Files.exists(tempDir.resolve("cache/data.db")));

        final String key = cache.store("model", Map.of(), "S", "U", "answer", 0, null);
        Assertions.assertTrue(new SqliteBackingStore(tempDir.resolve("cache/data.db")).containsKey(key));
    }

    @Test
    public void testSessionCacheTakesPriority() {
        final Cache session = new Cache();

        cacheHandler.setSessionCache(session);
        Assertions.assertTrue(cacheHandler.hasSessionCache());
        Assertions.assertSame(session, cacheHandler.getCache());

        cacheHandler.clearSessionCache();
        Assertions.assertFalse(cacheHandler.hasSessionCache());
        Assertions.assertNotSame(session, cacheHandler.getCache());
    }

    @Test
    public void testLegacyCacheIsMigrated() throws Exception {
        final Path legacy = tempDir.resolve("cache/responses.db");
        Files.createDirectories(legacy.getParent());
        LegacyCacheFixture.create(legacy, new String[]{"1", "m", "{'t': 0}", "s", "u", "o"});

        final Cache cache = cacheHandler.getCache();

        Assertions.assertEquals(1, cache.size());
        final CacheEntry entry = cache.values().get(0);
        Assertions.assertEquals("u", entry.userPrompt());
        Assertions.assertEquals(Map.of("t", 0), entry.parameters());
        Assertions.assertFalse(Files.exists(legacy));
        Assertions.assertTrue(Files.exists(tempDir.resolve("cache/responses.db.bak")));
    }

    @Test
    public void testFailedMigrationIsNotFatal() throws Exception {
        final Path legacy = tempDir.resolve("cache/responses.db");
        Files.createDirectories(legacy.getParent());
        LegacyCacheFixture.create(legacy, new String[]{"1", "m", "not a literal", "s", "u", "o"});

        final Cache cache = cacheHandler.getCache();

        Assertions.assertEquals(0, cache.size());
        Assertions.assertTrue(Files.exists(legacy));
    }

    @Test
    public void testMigrationRunsOnce() throws Exception {
        final Cache cache = cacheHandler.getCache();

        final Path legacy = tempDir.resolve("cache/responses.db");
        LegacyCacheFixture.create(legacy, new String[]{"1", "m", "{'t': 0}", "s", "u", "o"});

        Assertions.assertEquals(0, cacheHandler.getCache().size());
        Assertions.assertTrue(Files.exists(legacy));

        cacheHandler.reset();
        final Cache reopened = cacheHandler.getCache();
        Assertions.assertNotSame(cache, reopened);
        Assertions.assertEquals(1, reopened.size());
        Assertions.assertFalse(Files.exists(legacy));
    }
}
