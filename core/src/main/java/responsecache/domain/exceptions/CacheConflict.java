package responsecache.domain.exceptions;

/**
 * Thrown by the strict merge when an incoming key already exists with a different value.
 */
public class CacheConflict extends RuntimeException implements InternalException {
    public CacheConflict() {
        super();
    }

    public CacheConflict(final String message) {
        super(message);
    }

    public CacheConflict(final String message, final Throwable cause) {
        super(message, cause);
    }

    public CacheConflict(final Throwable cause) {
        super(cause);
    }
}
