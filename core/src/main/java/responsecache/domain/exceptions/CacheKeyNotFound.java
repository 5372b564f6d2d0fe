package responsecache.domain.exceptions;

/**
 * Represents an attempt to remove a key that is not in the backing store.
 */
public class CacheKeyNotFound extends RuntimeException implements InternalException {
    public CacheKeyNotFound() {
        super();
    }

    public CacheKeyNotFound(final String message) {
        super(message);
    }

    public CacheKeyNotFound(final String message, final Throwable cause) {
        super(message, cause);
    }

    public CacheKeyNotFound(final Throwable cause) {
        super(cause);
    }
}
