package responsecache.domain.cache;

import responsecache.domain.persist.SqliteBackingStore;

import java.nio.file.Path;

/**
 * Copies entries between a cache and a SQLite file.
 */
public class SqliteCachePersistence implements CachePersistence {
    @Override
    public void save(final Cache cache, final Path path) {
        new SqliteBackingStore(path).update(cache.items(), true);
    }

    @Override
    public void load(final Cache cache, final Path path, final boolean writeNow) {
        cache.addFromMap(new SqliteBackingStore(path).toMap(), writeNow);
    }
}
