package responsecache.domain.persist;

import responsecache.domain.entry.CacheEntry;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The mapping of cache keys to entries that sits underneath a cache.
 */
public interface BackingStore {
    /**
     * Get the entry saved against a key.
     *
     * @param key The cache key
     * @return The entry, if one was saved
     */
    Optional<CacheEntry> get(String key);

    /**
     * Save an entry, replacing any entry already saved against the key.
     *
     * @param key   The cache key
     * @param entry The entry to save
     */
    void put(String key, CacheEntry entry);

    /**
     * Remove an entry.
     *
     * @param key The cache key
     * @throws responsecache.domain.exceptions.CacheKeyNotFound if the key is not present
     */
    void delete(String key);

    boolean containsKey(String key);

    int size();

    List<String> keys();

    List<CacheEntry> values();

    /**
     * A snapshot of every key and entry in the store.
     */
    Map<String, CacheEntry> toMap();

    /**
     * Save many entries at once.
     *
     * @param entries   The entries to save
     * @param overwrite true to replace existing entries, false to leave existing keys untouched
     */
    void update(Map<String, CacheEntry> entries, boolean overwrite);

    default boolean isEmpty() {
        return size() == 0;
    }
}
