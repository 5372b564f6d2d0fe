package responsecache.infrastructure.remotecache;

import responsecache.domain.entry.CacheEntry;

import java.util.Collection;
import java.util.List;

/**
 * The remote counterpart of the local cache.
 */
public interface RemoteCacheClient {
    /**
     * Compare the local keys with the keys held by the remote.
     *
     * @param localKeys Every key held by the local cache
     * @return The entries the local cache is missing, and the keys the remote is missing
     */
    RemoteCacheDiff diff(Collection<String> localKeys);

    /**
     * Add entries to the remote. Entries the remote already holds are left alone.
     *
     * @param entries     The entries to add
     * @param visibility  Who can see the entries on the remote
     * @param description A description of the session that produced the entries
     */
    void createEntries(List<CacheEntry> entries, RemoteCacheVisibility visibility, String description);
}
