package responsecache.domain.exceptions;

/**
 * Marker interface for internal exceptions. Usually this means a configuration error or invalid inputs.
 * These exceptions typically can not be resolved by retrying.
 */
public interface InternalException {
}
