package responsecache.infrastructure.remotecache.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import responsecache.domain.entry.CacheEntry;
import responsecache.infrastructure.remotecache.RemoteCacheDiff;

import java.util.List;
import java.util.Map;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteCacheDiffResponse(
        @JsonProperty("client_missing_entries") List<Map<String, Object>> clientMissingEntries,
        @JsonProperty("server_missing_keys") List<String> serverMissingKeys) {

    public RemoteCacheDiff toDiff() {
        return new RemoteCacheDiff(
                Objects.requireNonNullElse(clientMissingEntries, List.<Map<String, Object>>of())
                        .stream()
                        .map(CacheEntry::fromMap)
                        .toList(),
                Objects.requireNonNullElse(serverMissingKeys, List.of()));
    }
}
