package responsecache.domain.cache;

import io.vavr.control.Try;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import responsecache.domain.entry.CacheEntry;
import responsecache.domain.exceptions.CacheValidationFailed;
import responsecache.domain.exceptions.LocalStorageFailure;
import responsecache.domain.json.JsonCodec;
import responsecache.domain.persist.TimedOperation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Saves a cache as JSON lines, each line holding a single {"key": {entry}} object.
 */
public class JsonlCachePersistence implements CachePersistence {
    private static final Logger logger = Logger.getLogger(JsonlCachePersistence.class.getName());

    @Override
    public void save(final Cache cache, final Path path) {
        final List<String> lines = cache.items().entrySet().stream()
                .map(entry -> JsonCodec.serialize(Collections.singletonMap(entry.getKey(), entry.getValue().toMap())))
                .toList();

        Try.withResources(() -> new TimedOperation("Write " + lines.size() + " entries to " + path))
                .of(timer -> writeAtomically(path, lines))
                .getOrElseThrow(ex -> new LocalStorageFailure("Failed to write cache to " + path, ex));
    }

    /**
     * The file is opened for reading and appending, so a missing file is created empty rather than treated as an
     * error.
     */
    @Override
    public void load(final Cache cache, final Path path, final boolean writeNow) {
        final List<String> lines = Try.of(() -> readOrCreate(path))
                .getOrElseThrow(ex -> new LocalStorageFailure("Failed to read cache file " + path, ex));

        final Map<String, CacheEntry> entries = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            if (StringUtils.isBlank(lines.get(i))) {
                continue;
            }

            final int lineNumber = i + 1;
            JsonCodec.deserializeMap(lines.get(i)).forEach((key, value) -> {
                if (!(value instanceof Map<?, ?> map)) {
                    throw new CacheValidationFailed("Line " + lineNumber + " of " + path + " does not hold a cache entry for key " + key);
                }
                entries.put(key, CacheEntry.fromMap(toStringKeyed(map)));
            });
        }

        logger.fine("Read " + entries.size() + " entries from " + path);
        cache.addFromMap(entries, writeNow);
    }

    private List<String> readOrCreate(final Path path) throws IOException {
        if (!Files.exists(path)) {
            Files.createFile(path);
        }
        return FileUtils.readLines(path.toFile(), StandardCharsets.UTF_8);
    }

    private Path writeAtomically(final Path path, final List<String> lines) throws IOException {
        final Path target = path.toAbsolutePath();
        Files.createDirectories(target.getParent());
        final Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            FileUtils.writeLines(temp.toFile(), StandardCharsets.UTF_8.name(), lines, "\n");
            return Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static Map<String, Object> toStringKeyed(final Map<?, ?> map) {
        final Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }
}
