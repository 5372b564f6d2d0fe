package responsecache.domain.exceptions;

/**
 * Represents a failure talking to the remote cache. The remote is additive and keyed by content hash, so the
 * same call can safely be retried.
 */
public class RemoteCacheFailure extends RuntimeException implements ExternalException {
    public RemoteCacheFailure() {
        super();
    }

    public RemoteCacheFailure(final String message) {
        super(message);
    }

    public RemoteCacheFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public RemoteCacheFailure(final Throwable cause) {
        super(cause);
    }
}
