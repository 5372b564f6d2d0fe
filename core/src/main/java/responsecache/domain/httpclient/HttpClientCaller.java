package responsecache.domain.httpclient;

/**
 * Builds a client, makes a request, parses the response and converts any failure into an exception.
 * The client and the response are closed once the response has been handled.
 */
public interface HttpClientCaller {
    <T> T call(ClientBuilder builder, ClientCallback callback, ResponseCallback<T> responseCallback, ExceptionBuilder exceptionBuilder);
}
