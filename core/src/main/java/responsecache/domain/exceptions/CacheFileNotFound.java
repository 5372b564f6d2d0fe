package responsecache.domain.exceptions;

/**
 * Represents a cache file that was expected to exist.
 */
public class CacheFileNotFound extends RuntimeException implements InternalException {
    public CacheFileNotFound() {
        super();
    }

    public CacheFileNotFound(final String message) {
        super(message);
    }

    public CacheFileNotFound(final String message, final Throwable cause) {
        super(message, cause);
    }

    public CacheFileNotFound(final Throwable cause) {
        super(cause);
    }
}
