package responsecache.infrastructure.remotecache.api;

import java.util.List;

public record RemoteCacheDiffRequest(List<String> keys) {
}
