package responsecache.domain.cache;

import org.jspecify.annotations.Nullable;

/**
 * Represents the result of a cache lookup.
 *
 * @param output The JSON encoded response, or null on a cache miss
 * @param key    The key the request hashed to, which is returned on a miss too so the caller can store against it
 */
public record CacheResult(@Nullable String output, String key) {
    public boolean fromCache() {
        return output != null;
    }
}
