package responsecache.domain.persist.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The location of the default persistent cache.
 */
@ApplicationScoped
public class CacheDatabasePath {
    private static final String DEFAULT_PATH = ".response_cache/data.db";
    private static final String SQLITE_URL_PREFIX = "sqlite:///";

    @Inject
    @ConfigProperty(name = "rc.cache.path")
    private Optional<String> path;

    /**
     * Both a plain path and a sqlite:/// URL are accepted, since older configuration files hold the URL form.
     */
    public Path getDatabasePath() {
        return Path.of(path
                .map(p -> p.startsWith(SQLITE_URL_PREFIX) ? p.substring(SQLITE_URL_PREFIX.length()) : p)
                .orElse(DEFAULT_PATH));
    }
}
