package responsecache.domain.httpclient;

public interface ExceptionBuilder {
    RuntimeException buildException(Throwable cause);
}
