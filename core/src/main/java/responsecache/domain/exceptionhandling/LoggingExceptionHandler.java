package responsecache.domain.exceptionhandling;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import responsecache.domain.exceptions.ExternalException;

@ApplicationScoped
public class LoggingExceptionHandler implements ExceptionHandler {

    @Inject
    @ConfigProperty(name = "rc.exceptions.printstacktrace", defaultValue = "false")
    private String printStackTrace;

    @Override
    public String getExceptionMessage(final Throwable e) {
        if (e == null) {
            return "Exception was null";
        }

        // Remote failures are the ones worth a full trace, since they are the ones that get retried
        if (Boolean.parseBoolean(printStackTrace) || e instanceof ExternalException) {
            return ExceptionUtils.getStackTrace(e);
        }

        if (StringUtils.isBlank(e.getMessage())) {
            return e.toString();
        }

        final Throwable root = ExceptionUtils.getRootCause(e);
        if (root != null && root != e && StringUtils.isNotBlank(root.getMessage())) {
            return e.getMessage() + ": " + root.getMessage();
        }

        return e.getMessage();
    }
}
