package responsecache.domain.persist.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.util.Optional;

@ApplicationScoped
public class LegacyCacheDatabasePath {
    private static final String DEFAULT_PATH = ".response_cache/responses.db";

    @Inject
    @ConfigProperty(name = "rc.cache.legacypath")
    private Optional<String> path;

    public Path getDatabasePath() {
        return Path.of(path.orElse(DEFAULT_PATH));
    }
}
