package responsecache.domain.persist;

import responsecache.domain.entry.CacheEntry;
import responsecache.domain.exceptions.CacheKeyNotFound;
import responsecache.domain.exceptions.CacheValidationFailed;

import java.util.*;

/**
 * Keeps entries in an insertion ordered map owned by this instance. Nothing is persisted.
 */
public class InMemoryBackingStore implements BackingStore {
    private final Map<String, CacheEntry> data = new LinkedHashMap<>();

    public InMemoryBackingStore() {
    }

    public InMemoryBackingStore(final Map<String, CacheEntry> initial) {
        update(initial, true);
    }

    @Override
    public Optional<CacheEntry> get(final String key) {
        return Optional.ofNullable(data.get(key));
    }

    @Override
    public void put(final String key, final CacheEntry entry) {
        if (key == null) {
            throw new CacheValidationFailed("Key must not be null");
        }
        if (entry == null) {
            throw new CacheValidationFailed("Value must be a CacheEntry object (got null) for key " + key);
        }
        data.put(key, entry);
    }

    @Override
    public void delete(final String key) {
        if (!data.containsKey(key)) {
            throw new CacheKeyNotFound("Key '" + key + "' not found.");
        }
        data.remove(key);
    }

    @Override
    public boolean containsKey(final String key) {
        return data.containsKey(key);
    }

    @Override
    public int size() {
        return data.size();
    }

    @Override
    public List<String> keys() {
        return List.copyOf(data.keySet());
    }

    @Override
    public List<CacheEntry> values() {
        return List.copyOf(data.values());
    }

    @Override
    public Map<String, CacheEntry> toMap() {
        return new LinkedHashMap<>(data);
    }

    @Override
    public void update(final Map<String, CacheEntry> entries, final boolean overwrite) {
        entries.forEach((key, entry) -> {
            if (overwrite || !data.containsKey(key)) {
                put(key, entry);
            }
        });
    }

    @Override
    public String toString() {
        return "InMemoryBackingStore(size=" + data.size() + ")";
    }
}
