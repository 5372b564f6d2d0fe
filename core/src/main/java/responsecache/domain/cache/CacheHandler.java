package responsecache.domain.cache;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jspecify.annotations.Nullable;
import responsecache.domain.exceptionhandling.ExceptionHandler;
import responsecache.domain.exceptions.LocalStorageFailure;
import responsecache.domain.migration.LegacyCacheMigrator;
import responsecache.domain.persist.config.CacheDatabasePath;
import responsecache.domain.persist.config.LegacyCacheDatabasePath;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Decides which cache the rest of the process uses.
 * <p>
 * By default that is a SQLite backed cache at the configured path, created the first time it is asked for. A
 * session cache can be set to take its place, which is how tests keep their entries out of the shared file.
 * <p>
 * The first time a cache is handed out, any legacy cache file is migrated into it. A failed migration is logged
 * and skipped: callers always get a usable cache.
 */
@ApplicationScoped
public class CacheHandler {

    @Inject
    private CacheDatabasePath cacheDatabasePath;

    @Inject
    private LegacyCacheDatabasePath legacyCacheDatabasePath;

    @Inject
    private LegacyCacheMigrator legacyCacheMigrator;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    @Nullable
    private Cache sessionCache;

    @Nullable
    private Cache defaultCache;

    private boolean migrationAttempted;

    /**
     * The active cache: the session cache when one is set, otherwise the default persistent cache.
     */
    public synchronized Cache getCache() {
        final Cache cache = sessionCache != null ? sessionCache : getDefaultCache();

        if (!migrationAttempted) {
            migrationAttempted = true;
            migrateLegacyCache(cache);
        }

        return cache;
    }

    public synchronized void setSessionCache(final Cache cache) {
        this.sessionCache = cache;
    }

    public synchronized void clearSessionCache() {
        this.sessionCache = null;
    }

    public synchronized boolean hasSessionCache() {
        return sessionCache != null;
    }

    /**
     * Forget the default cache and allow the migration to run again.
     */
    public synchronized void reset() {
        defaultCache = null;
        migrationAttempted = false;
    }

    private Cache getDefaultCache() {
        if (defaultCache == null) {
            final Path path = cacheDatabasePath.getDatabasePath().toAbsolutePath();
            final Path parent = path.getParent();
            if (parent != null) {
                Try.of(() -> Files.createDirectories(parent))
                        .getOrElseThrow(ex -> new LocalStorageFailure("Failed to create cache directory " + parent, ex));
            }

            logger.fine("Opening cache at " + path);
            defaultCache = Cache.fromSqliteDb(path);
        }

        return defaultCache;
    }

    private void migrateLegacyCache(final Cache cache) {
        final Path legacyPath = legacyCacheDatabasePath.getDatabasePath();
        if (!Files.exists(legacyPath)) {
            return;
        }

        Try.of(() -> legacyCacheMigrator.migrate(legacyPath, cache))
                .onSuccess(count -> logger.info("Legacy cache migration moved " + count + " entries"))
                .onFailure(ex -> logger.warning("Legacy cache migration failed, continuing without it: "
                        + exceptionHandler.getExceptionMessage(ex)));
    }
}
