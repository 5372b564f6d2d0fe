package responsecache.domain.sync;

import io.vavr.API;
import io.vavr.control.Try;
import responsecache.domain.cache.Cache;
import responsecache.domain.entry.CacheEntry;
import responsecache.domain.exceptions.CacheValidationFailed;
import responsecache.domain.exceptions.RemoteCacheFailure;
import responsecache.infrastructure.remotecache.RemoteCacheClient;
import responsecache.infrastructure.remotecache.RemoteCacheDiff;
import responsecache.infrastructure.remotecache.RemoteCacheVisibility;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Predicates.instanceOf;

/**
 * A session that keeps a local cache in step with the remote cache.
 * <p>
 * Opening the session downloads the entries the remote has and the local cache lacks. Closing it uploads the
 * entries the remote lacks, including anything added to the local cache while the session was open. A failed
 * upload is thrown from {@link #close()}; the downloaded entries stay in the local cache either way.
 * <p>
 * When the session is disabled, opening and closing it does nothing beyond moving through the states.
 */
public class RemoteCacheSync implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RemoteCacheSync.class.getName());

    public enum State {
        CREATED,
        SYNCING_DOWN,
        ACTIVE,
        SYNCING_UP,
        CLOSED
    }

    private final RemoteCacheClient client;
    private final Cache cache;
    private final boolean enabled;
    private final RemoteCacheVisibility visibility;
    private final String description;

    private State state = State.CREATED;
    private Set<String> initialCacheKeys = Set.of();
    private List<String> serverMissingKeys = List.of();
    private int downloadedCount;
    private int uploadedCount;

    public RemoteCacheSync(
            final RemoteCacheClient client,
            final Cache cache,
            final boolean enabled,
            final RemoteCacheVisibility visibility,
            final String description) {
        this.client = checkNotNull(client);
        this.cache = checkNotNull(cache);
        this.enabled = enabled;
        this.visibility = checkNotNull(visibility);
        this.description = description == null ? "" : description;
    }

    /**
     * Create a session and run the download step.
     */
    public static RemoteCacheSync open(
            final RemoteCacheClient client,
            final Cache cache,
            final boolean enabled,
            final RemoteCacheVisibility visibility,
            final String description) {
        final RemoteCacheSync sync = new RemoteCacheSync(client, cache, enabled, visibility, description);
        sync.start();
        return sync;
    }

    /**
     * Compare the key sets, merge the missing entries into the local cache, and record the keys the cache holds
     * afterwards.
     */
    public void start() {
        if (state != State.CREATED) {
            throw new CacheValidationFailed("Remote cache sync has already been started");
        }

        if (enabled) {
            state = State.SYNCING_DOWN;

            final RemoteCacheDiff diff = client.diff(cache.keys());
            serverMissingKeys = diff.serverMissingKeys();

            final Map<String, CacheEntry> missing = new LinkedHashMap<>();
            diff.clientMissingEntries().forEach(entry -> missing.put(entry.key(), entry));
            cache.addFromMap(missing);
            downloadedCount = missing.size();

            logger.info("Downloaded " + downloadedCount + " entries from the remote cache, "
                    + serverMissingKeys.size() + " local entries are missing from the remote");
        }

        initialCacheKeys = Set.copyOf(cache.keys());
        state = State.ACTIVE;
    }

    /**
     * The entries the remote does not have: those it reported missing when the session opened, plus any added to
     * the local cache since.
     */
    public Map<String, CacheEntry> getUploadCandidates() {
        final Map<String, CacheEntry> current = new LinkedHashMap<>(cache.items());
        current.putAll(cache.getPendingWrites());

        final Set<String> serverMissing = new HashSet<>(serverMissingKeys);
        final Map<String, CacheEntry> candidates = new LinkedHashMap<>();
        current.forEach((key, entry) -> {
            if (serverMissing.contains(key) || !initialCacheKeys.contains(key)) {
                candidates.put(key, entry);
            }
        });
        return candidates;
    }

    /**
     * Upload the candidates. Calling this more than once has no further effect.
     */
    @Override
    public void close() {
        if (state == State.CLOSED) {
            return;
        }

        if (state == State.CREATED) {
            state = State.CLOSED;
            return;
        }

        state = State.SYNCING_UP;
        try {
            if (enabled) {
                upload();
            }
        } finally {
            state = State.CLOSED;
        }
    }

    private void upload() {
        final List<CacheEntry> candidates = List.copyOf(getUploadCandidates().values());
        if (candidates.isEmpty()) {
            logger.info("The remote cache is up to date, nothing to upload");
            return;
        }

        Try.run(() -> client.createEntries(candidates, visibility, description))
                .mapFailure(
                        API.Case(API.$(instanceOf(RemoteCacheFailure.class)), ex -> ex),
                        API.Case(API.$(), ex -> new RemoteCacheFailure("Failed to upload " + candidates.size() + " entries to the remote cache", ex)))
                .get();

        uploadedCount = candidates.size();
        logger.info("Uploaded " + uploadedCount + " entries to the remote cache");
    }

    public State getState() {
        return state;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Set<String> getInitialCacheKeys() {
        return initialCacheKeys;
    }

    public List<String> getServerMissingKeys() {
        return serverMissingKeys;
    }

    public int getDownloadedCount() {
        return downloadedCount;
    }

    public int getUploadedCount() {
        return uploadedCount;
    }
}
