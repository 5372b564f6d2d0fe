package responsecache.infrastructure.remotecache.api;

import java.util.List;
import java.util.Map;

/**
 * The body of a bulk create call. Each entry is the map produced by CacheEntry.toMap().
 */
public record RemoteCacheBatchRequest(List<Map<String, Object>> entries, String visibility, String description) {
}
