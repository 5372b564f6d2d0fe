package responsecache.domain.migration;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import responsecache.domain.cache.Cache;
import responsecache.domain.entry.CacheEntry;
import responsecache.domain.exceptions.CacheFileNotFound;
import responsecache.domain.exceptions.CacheValidationFailed;
import responsecache.domain.exceptions.LocalStorageFailure;
import responsecache.domain.tryext.TryExtensions;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import static com.google.common.base.Predicates.instanceOf;

/**
 * Moves entries out of the single table SQLite format used before the key/value cache existed.
 * <p>
 * The legacy table is {@code responses(id, model, parameters, system_prompt, prompt, output)}, where
 * {@code parameters} holds a Python literal rather than JSON. Once the rows are merged into the target cache the
 * legacy file is copied to a {@code .bak} sibling and removed.
 */
@ApplicationScoped
public class LegacyCacheMigrator {
    public static final String BACKUP_SUFFIX = ".bak";

    private static final String SELECT_ROWS = """
            SELECT id, model, parameters, system_prompt, prompt, output
            FROM responses""";

    @Inject
    private Logger logger;

    /**
     * Merge the legacy file into the cache.
     *
     * @param legacyDb The legacy SQLite file
     * @param target   The cache to merge into
     * @return The number of entries read from the legacy file
     */
    public int migrate(final Path legacyDb, final Cache target) {
        if (!Files.exists(legacyDb)) {
            throw new CacheFileNotFound("Legacy cache " + legacyDb + " not found");
        }

        logger.info("Migrating legacy cache " + legacyDb);

        final Map<String, CacheEntry> entries = readEntries(legacyDb);
        target.addFromMap(entries, true);
        final Path backup = backupAndRemove(legacyDb);

        logger.info("Migrated " + entries.size() + " entries from " + legacyDb + ", backup saved to " + backup);
        return entries.size();
    }

    /**
     * Read every row of the legacy table, converting each one to an entry. Rows that hash to the same key collapse
     * into the last one read.
     */
    public Map<String, CacheEntry> readEntries(final Path legacyDb) {
        return TryExtensions.withResources(
                        () -> DriverManager.getConnection("jdbc:sqlite:" + legacyDb.toAbsolutePath()),
                        (Connection connection) -> connection.prepareStatement(SELECT_ROWS),
                        (PreparedStatement statement) -> Try.withResources(statement::executeQuery)
                                .of(this::toEntries)
                                .get())
                .mapFailure(
                        API.Case(API.$(instanceOf(CacheValidationFailed.class)), ex -> ex),
                        API.Case(API.$(), ex -> new LocalStorageFailure("Failed to read legacy cache " + legacyDb, ex)))
                .get();
    }

    private Map<String, CacheEntry> toEntries(final ResultSet resultSet) throws SQLException {
        final Map<String, CacheEntry> entries = new LinkedHashMap<>();
        while (resultSet.next()) {
            final CacheEntry entry = CacheEntry.builder()
                    .model(resultSet.getString("model"))
                    .parameters(PythonLiteralParser.parseDict(resultSet.getString("parameters")))
                    .systemPrompt(resultSet.getString("system_prompt"))
                    .userPrompt(resultSet.getString("prompt"))
                    .output(resultSet.getString("output"))
                    .build();
            entries.put(entry.key(), entry);
        }
        return entries;
    }

    private Path backupAndRemove(final Path legacyDb) {
        final Path backup = legacyDb.resolveSibling(legacyDb.getFileName() + BACKUP_SUFFIX);
        return Try.of(() -> Files.copy(legacyDb, backup, StandardCopyOption.REPLACE_EXISTING))
                .andThenTry(() -> Files.delete(legacyDb))
                .getOrElseThrow(ex -> new LocalStorageFailure("Failed to back up legacy cache " + legacyDb, ex));
    }
}
