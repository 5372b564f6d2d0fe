package responsecache.domain.exceptions;

/**
 * Represents a value that does not have the shape of a cache entry, or a cache that was configured with
 * incompatible options (an unsupported file extension, or both a filename and explicit data).
 */
public class CacheValidationFailed extends RuntimeException implements InternalException {
    public CacheValidationFailed() {
        super();
    }

    public CacheValidationFailed(final String message) {
        super(message);
    }

    public CacheValidationFailed(final String message, final Throwable cause) {
        super(message, cause);
    }

    public CacheValidationFailed(final Throwable cause) {
        super(cause);
    }
}
