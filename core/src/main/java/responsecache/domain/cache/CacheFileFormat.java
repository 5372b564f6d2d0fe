package responsecache.domain.cache;

import responsecache.domain.exceptions.CacheValidationFailed;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * The file formats a cache can be saved to, selected by file extension.
 */
public enum CacheFileFormat {
    JSONL(".jsonl", new JsonlCachePersistence()),
    SQLITE(".db", new SqliteCachePersistence());

    private final String extension;
    private final CachePersistence persistence;

    CacheFileFormat(final String extension, final CachePersistence persistence) {
        this.extension = extension;
        this.persistence = persistence;
    }

    public static CacheFileFormat fromPath(final Path path) {
        final String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
        return Arrays.stream(values())
                .filter(format -> fileName.endsWith(format.extension))
                .findFirst()
                .orElseThrow(() -> new CacheValidationFailed(
                        "Invalid file extension for " + path + ". Must be .jsonl or .db"));
    }

    public String getExtension() {
        return extension;
    }

    public CachePersistence persistence() {
        return persistence;
    }
}
