package responsecache.domain.cache;

import java.nio.file.Path;

/**
 * Saves a whole cache to a file, and merges a file back into a cache.
 */
public interface CachePersistence {
    /**
     * Write every entry in the cache to the file, replacing its contents.
     */
    void save(Cache cache, Path path);

    /**
     * Merge the entries held in the file into the cache using the strict merge.
     *
     * @param writeNow true to write the entries to the backing store immediately, false to buffer them until the
     *                 cache is closed
     */
    void load(Cache cache, Path path, boolean writeNow);
}
