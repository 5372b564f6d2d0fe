package responsecache.domain.httpclient;

import jakarta.enterprise.context.ApplicationScoped;
import responsecache.domain.tryext.TryExtensions;

@ApplicationScoped
public class TryHttpClientCalled implements HttpClientCaller {

    @Override
    public <T> T call(final ClientBuilder builder, final ClientCallback callback, final ResponseCallback<T> responseCallback, final ExceptionBuilder exceptionBuilder) {
        // Clients are not guaranteed to be thread safe, so a new client is built for each call.
        return TryExtensions.withResources(
                        builder::buildClient,
                        callback::call,
                        responseCallback::handleResponse)
                .getOrElseThrow(exceptionBuilder::buildException);
    }
}
