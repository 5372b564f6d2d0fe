package responsecache.domain.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import responsecache.domain.cache.Cache;
import responsecache.domain.injection.Preferred;
import responsecache.infrastructure.remotecache.RemoteCacheClient;
import responsecache.infrastructure.remotecache.RemoteCacheVisibility;

/**
 * Opens sync sessions against the configured remote cache.
 */
@ApplicationScoped
public class RemoteCacheSyncService {
    @Inject
    @Preferred
    private RemoteCacheClient remoteCacheClient;

    @Inject
    @ConfigProperty(name = "rc.remotecache.enabled", defaultValue = "false")
    private String enabled;

    @Inject
    @ConfigProperty(name = "rc.remotecache.visibility", defaultValue = "private")
    private String visibility;

    public boolean isEnabled() {
        return Boolean.parseBoolean(enabled.trim());
    }

    public RemoteCacheVisibility getVisibility() {
        return RemoteCacheVisibility.fromString(visibility);
    }

    /**
     * Open a session, downloading any missing entries into the cache. Close the session to upload.
     */
    public RemoteCacheSync open(final Cache cache, final String description) {
        return RemoteCacheSync.open(remoteCacheClient, cache, isEnabled(), getVisibility(), description);
    }

    /**
     * Open a session with the remote sync switched on or off regardless of the configuration.
     */
    public RemoteCacheSync open(final Cache cache, final String description, final boolean enableSync) {
        return RemoteCacheSync.open(remoteCacheClient, cache, enableSync, getVisibility(), description);
    }
}
