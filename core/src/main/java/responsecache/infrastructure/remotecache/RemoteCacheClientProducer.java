package responsecache.infrastructure.remotecache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import responsecache.domain.config.MockConfig;
import responsecache.domain.injection.Preferred;

/**
 * Produces a RemoteCacheClient instance based on the configuration.
 */
public class RemoteCacheClientProducer {

    @Inject
    private MockConfig mockConfig;

    @Produces
    @Preferred
    @ApplicationScoped
    public RemoteCacheClient produceRemoteCacheClient(final RemoteCacheClientLive remoteCacheClientLive,
                                                      final RemoteCacheClientMock remoteCacheClientMock) {
        if (mockConfig.isMock()) {
            return remoteCacheClientMock;
        }

        return remoteCacheClientLive;
    }
}
