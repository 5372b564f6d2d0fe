package responsecache.domain.response;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;
import responsecache.domain.exceptions.RemoteCacheFailure;

@ApplicationScoped
public class OkResponseValidation implements ResponseValidation {
    @Override
    public Response validate(final Response response, final String uri) {
        if (response.getStatus() == 401 || response.getStatus() == 403) {
            throw new RemoteCacheFailure("Expected status code 200, but got " + response.getStatus()
                    + " from URI " + uri + ". This likely indicates the API key is missing or invalid.");
        }

        if (response.getStatus() != 200 && response.getStatus() != 201) {
            throw new RemoteCacheFailure("Expected status code 200, but got "
                    + response.getStatus()
                    + " from URI " + uri + ". " + getResponseBody(response));
        }

        return response;
    }

    private String getResponseBody(final Response response) {
        return Try.of(() -> response.readEntity(String.class))
                .getOrElse("No response body available");
    }
}
