package responsecache.infrastructure.remotecache;

import jakarta.enterprise.context.ApplicationScoped;
import responsecache.domain.entry.CacheEntry;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A remote cache held in memory. Like the real service it only ever adds entries.
 */
@ApplicationScoped
public class RemoteCacheClientMock implements RemoteCacheClient {
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private int uploadCount;

    @Override
    public synchronized RemoteCacheDiff diff(final Collection<String> localKeys) {
        final Set<String> local = new HashSet<>(localKeys);

        return new RemoteCacheDiff(
                entries.entrySet().stream()
                        .filter(entry -> !local.contains(entry.getKey()))
                        .map(Map.Entry::getValue)
                        .toList(),
                localKeys.stream()
                        .filter(key -> !entries.containsKey(key))
                        .distinct()
                        .toList());
    }

    @Override
    public synchronized void createEntries(final List<CacheEntry> newEntries, final RemoteCacheVisibility visibility, final String description) {
        uploadCount++;
        newEntries.forEach(entry -> entries.putIfAbsent(entry.key(), entry));
    }

    public synchronized Map<String, CacheEntry> getEntries() {
        return Map.copyOf(entries);
    }

    public synchronized int getUploadCount() {
        return uploadCount;
    }

    public synchronized void addEntries(final Collection<CacheEntry> newEntries) {
        newEntries.forEach(entry -> entries.putIfAbsent(entry.key(), entry));
    }

    public synchronized void clear() {
        entries.clear();
        uploadCount = 0;
    }
}
