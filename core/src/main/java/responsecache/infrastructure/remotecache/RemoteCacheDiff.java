package responsecache.infrastructure.remotecache;

import responsecache.domain.entry.CacheEntry;

import java.util.List;

/**
 * The result of comparing the local and remote key sets.
 *
 * @param clientMissingEntries Entries the remote holds that the local cache does not
 * @param serverMissingKeys    Keys the local cache holds that the remote does not
 */
public record RemoteCacheDiff(List<CacheEntry> clientMissingEntries, List<String> serverMissingKeys) {
    public RemoteCacheDiff {
        clientMissingEntries = clientMissingEntries == null ? List.of() : List.copyOf(clientMissingEntries);
        serverMissingKeys = serverMissingKeys == null ? List.of() : List.copyOf(serverMissingKeys);
    }
}
