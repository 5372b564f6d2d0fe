package responsecache.domain.exceptionhandling;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import responsecache.domain.exceptions.CacheValidationFailed;
import responsecache.domain.exceptions.LocalStorageFailure;
import responsecache.domain.exceptions.RemoteCacheFailure;

import java.sql.SQLException;
import java.util.Map;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(LoggingExceptionHandler.class)
public class LoggingExceptionHandlerTest {

    @Inject
    ExceptionHandler exceptionHandler;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of("rc.exceptions.printstacktrace", "false"),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    public void testMessage() {
        Assertions.assertEquals("bad extension",
                exceptionHandler.getExceptionMessage(new CacheValidationFailed("bad extension")));
    }

    @Test
    public void testRootCauseIsAppended() {
        final LocalStorageFailure failure = new LocalStorageFailure("Failed to read", new SQLException("disk full"));
        Assertions.assertEquals("Failed to read: disk full", exceptionHandler.getExceptionMessage(failure));
    }

    @Test
    public void testExternalExceptionsIncludeStackTrace() {
        final String message = exceptionHandler.getExceptionMessage(new RemoteCacheFailure("remote down"));
        Assertions.assertTrue(message.contains("remote down"));
        Assertions.assertTrue(message.contains("at "));
    }

    @Test
    public void testNull() {
        Assertions.assertEquals("Exception was null", exceptionHandler.getExceptionMessage(null));
    }
}
