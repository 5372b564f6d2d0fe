package responsecache.infrastructure.remotecache;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.core.MediaType;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import responsecache.domain.entry.CacheEntry;
import responsecache.domain.exceptions.RemoteCacheFailure;
import responsecache.domain.httpclient.HttpClientCaller;
import responsecache.domain.response.ResponseValidation;
import responsecache.infrastructure.remotecache.api.RemoteCacheBatchRequest;
import responsecache.infrastructure.remotecache.api.RemoteCacheDiffRequest;
import responsecache.infrastructure.remotecache.api.RemoteCacheDiffResponse;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Talks to the remote cache service over HTTP.
 */
@ApplicationScoped
public class RemoteCacheClientLive implements RemoteCacheClient {
    private static final long API_CONNECTION_TIMEOUT_SECONDS_DEFAULT = 10;
    private static final long API_CALL_TIMEOUT_SECONDS_DEFAULT = 60 * 2;
    private static final String DIFF_PATH = "/api/v0/remote-cache/get-diff";
    private static final String BATCH_PATH = "/api/v0/remote-cache/batch";

    @Inject
    @ConfigProperty(name = "rc.remotecache.url", defaultValue = "http://localhost:8000")
    private String url;

    @Inject
    @ConfigProperty(name = "rc.remotecache.apikey")
    private Optional<String> apiKey;

    @Inject
    private ResponseValidation responseValidation;

    @Inject
    private HttpClientCaller httpClientCaller;

    @Inject
    private Logger logger;

    private Client getClient() {
        final ClientBuilder clientBuilder = ClientBuilder.newBuilder();
        clientBuilder.connectTimeout(API_CONNECTION_TIMEOUT_SECONDS_DEFAULT, TimeUnit.SECONDS);
        clientBuilder.readTimeout(API_CALL_TIMEOUT_SECONDS_DEFAULT, TimeUnit.SECONDS);
        return clientBuilder.build();
    }

    @Override
    public RemoteCacheDiff diff(final Collection<String> localKeys) {
        final String target = StringUtils.removeEnd(url, "/") + DIFF_PATH;

        logger.fine("Comparing " + localKeys.size() + " keys with the remote cache at " + target);

        return httpClientCaller.call(
                this::getClient,
                client -> authorize(client.target(target).request(MediaType.APPLICATION_JSON_TYPE))
                        .post(Entity.entity(new RemoteCacheDiffRequest(List.copyOf(localKeys)), MediaType.APPLICATION_JSON)),
                response -> Try.of(() -> responseValidation.validate(response, target))
                        .map(r -> r.readEntity(RemoteCacheDiffResponse.class))
                        .map(RemoteCacheDiffResponse::toDiff)
                        .get(),
                e -> asRemoteCacheFailure("Failed to get the diff from the remote cache", e));
    }

    @Override
    public void createEntries(final List<CacheEntry> entries, final RemoteCacheVisibility visibility, final String description) {
        final String target = StringUtils.removeEnd(url, "/") + BATCH_PATH;

        logger.fine("Uploading " + entries.size() + " entries to the remote cache at " + target);

        final RemoteCacheBatchRequest body = new RemoteCacheBatchRequest(
                entries.stream().map(CacheEntry::toMap).toList(),
                visibility.wireValue(),
                description);

        httpClientCaller.call(
                this::getClient,
                client -> authorize(client.target(target).request(MediaType.APPLICATION_JSON_TYPE))
                        .post(Entity.entity(body, MediaType.APPLICATION_JSON)),
                response -> responseValidation.validate(response, target).getStatus(),
                e -> asRemoteCacheFailure("Failed to upload entries to the remote cache", e));
    }

    private Invocation.Builder authorize(final Invocation.Builder builder) {
        return apiKey
                .filter(StringUtils::isNotBlank)
                .map(key -> builder.header("Authorization", "Bearer " + key))
                .orElse(builder);
    }

    private RuntimeException asRemoteCacheFailure(final String message, final Throwable cause) {
        if (cause instanceof RemoteCacheFailure failure) {
            return failure;
        }
        return new RemoteCacheFailure(message, cause);
    }
}
