package responsecache.domain.exceptionhandling;

/**
 * Turns an exception into something that can be written to a log.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
