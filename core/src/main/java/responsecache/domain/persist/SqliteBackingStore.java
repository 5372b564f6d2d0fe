package responsecache.domain.persist;

import io.vavr.API;
import io.vavr.CheckedFunction1;
import io.vavr.control.Try;
import responsecache.domain.entry.CacheEntry;
import responsecache.domain.exceptions.CacheKeyNotFound;
import responsecache.domain.exceptions.CacheValidationFailed;
import responsecache.domain.exceptions.DeserializationFailed;
import responsecache.domain.exceptions.LocalStorageFailure;
import responsecache.domain.json.JsonCodec;
import responsecache.domain.tryext.TryExtensions;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;
import java.util.logging.Logger;

import static com.google.common.base.Predicates.instanceOf;

/**
 * Saves entries in a SQLite file, one row per key with the entry held as JSON.
 * <p>
 * Every operation opens a connection, does its work in a transaction, commits and closes the connection again.
 * That is slower than holding a connection open, but it means a crash can never leave a half written row, and
 * any number of stores in the same process can point at the same file. Bulk loads go through
 * {@link #update(Map, boolean, int)}, which commits once per batch instead of once per row.
 */
public class SqliteBackingStore implements BackingStore {
    public static final int DEFAULT_MAX_BATCH_SIZE = 100;

    private static final Logger logger = Logger.getLogger(SqliteBackingStore.class.getName());

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS data (
            key TEXT PRIMARY KEY,
            value TEXT)""";

    private final Path path;
    private final String jdbcUrl;

    public SqliteBackingStore(final Path path) {
        this.path = path.toAbsolutePath();
        this.jdbcUrl = "jdbc:sqlite:" + this.path;

        final Path parent = this.path.getParent();
        if (parent != null) {
            Try.of(() -> Files.createDirectories(parent))
                    .getOrElseThrow(ex -> new LocalStorageFailure("Failed to create directory " + parent, ex));
        }

        inTransaction("create the data table", tx -> Try.withResources(() -> tx.prepare(CREATE_TABLE))
                .of(PreparedStatement::executeUpdate)
                .get());
    }

    public Path getPath() {
        return path;
    }

    @Override
    public Optional<CacheEntry> get(final String key) {
        return inTransaction("read key " + key, tx -> TryExtensions.withResources(
                        () -> bind(tx, "SELECT value FROM data WHERE key = ?", key),
                        PreparedStatement::executeQuery,
                        resultSet -> resultSet.next()
                                ? Optional.of(decode(resultSet.getString(1)))
                                : Optional.<CacheEntry>empty())
                .get());
    }

    @Override
    public void put(final String key, final CacheEntry entry) {
        validate(key, entry);

        inTransaction("write key " + key, tx -> Try.withResources(
                        () -> bind(tx, "INSERT OR REPLACE INTO data (key, value) VALUES (?, ?)", key, encode(entry)))
                .of(PreparedStatement::executeUpdate)
                .get());
    }

    @Override
    public void delete(final String key) {
        inTransaction("delete key " + key, tx -> Try.withResources(
                        () -> bind(tx, "DELETE FROM data WHERE key = ?", key))
                .of(PreparedStatement::executeUpdate)
                .filter(count -> count > 0, () -> new CacheKeyNotFound("Key '" + key + "' not found."))
                .get());
    }

    @Override
    public boolean containsKey(final String key) {
        return inTransaction("check key " + key, tx -> TryExtensions.withResources(
                        () -> bind(tx, "SELECT 1 FROM data WHERE key = ?", key),
                        PreparedStatement::executeQuery,
                        ResultSet::next)
                .get());
    }

    @Override
    public int size() {
        return inTransaction("count rows", tx -> TryExtensions.withResources(
                        () -> tx.prepare("SELECT COUNT(*) FROM data"),
                        PreparedStatement::executeQuery,
                        resultSet -> resultSet.next() ? resultSet.getInt(1) : 0)
                .get());
    }

    @Override
    public List<String> keys() {
        return inTransaction("list keys", tx -> TryExtensions.withResources(
                        () -> tx.prepare("SELECT key FROM data"),
                        PreparedStatement::executeQuery,
                        resultSet -> {
                            final List<String> keys = new ArrayList<>();
                            while (resultSet.next()) {
                                keys.add(resultSet.getString(1));
                            }
                            return keys;
                        })
                .get());
    }

    @Override
    public List<CacheEntry> values() {
        return List.copyOf(toMap().values());
    }

    @Override
    public Map<String, CacheEntry> toMap() {
        return inTransaction("list entries", tx -> TryExtensions.withResources(
                        () -> tx.prepare("SELECT key, value FROM data"),
                        PreparedStatement::executeQuery,
                        resultSet -> {
                            final Map<String, CacheEntry> entries = new LinkedHashMap<>();
                            while (resultSet.next()) {
                                entries.put(resultSet.getString(1), decode(resultSet.getString(2)));
                            }
                            return entries;
                        })
                .get());
    }

    @Override
    public void update(final Map<String, CacheEntry> entries, final boolean overwrite) {
        update(entries, overwrite, DEFAULT_MAX_BATCH_SIZE);
    }

    /**
     * Save many entries, committing every {@code maxBatchSize} rows. A crash part way through loses at most the
     * rows of the batch in flight; every committed row is complete.
     *
     * @param entries      The entries to save
     * @param overwrite    true to replace rows that already exist, false to skip them
     * @param maxBatchSize The number of rows written per commit
     */
    public void update(final Map<String, CacheEntry> entries, final boolean overwrite, final int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new CacheValidationFailed("maxBatchSize must be at least 1 (got " + maxBatchSize + ")");
        }

        if (entries == null) {
            throw new CacheValidationFailed("Entries to update must not be null");
        }

        // Validate everything up front so a bad value can't leave a partial update behind
        entries.forEach(this::validate);

        if (entries.isEmpty()) {
            return;
        }

        final String sql = overwrite
                ? "INSERT OR REPLACE INTO data (key, value) VALUES (?, ?)"
                : "INSERT OR IGNORE INTO data (key, value) VALUES (?, ?)";

        Try.withResources(() -> new TimedOperation("SQLite update of " + entries.size() + " entries in " + path, 1000))
                .of(timer -> inTransaction("update " + entries.size() + " entries", tx -> Try.withResources(() -> tx.prepare(sql))
                        .of(statement -> writeBatches(tx, statement, entries, maxBatchSize))
                        .get()))
                .get();
    }

    private int writeBatches(
            final SqliteTransaction tx,
            final PreparedStatement statement,
            final Map<String, CacheEntry> entries,
            final int maxBatchSize) throws SQLException {
        int currentBatch = 0;
        int written = 0;
        for (final Map.Entry<String, CacheEntry> entry : entries.entrySet()) {
            if (currentBatch == maxBatchSize) {
                tx.commit();
                currentBatch = 0;
            }

            statement.setString(1, entry.getKey());
            statement.setString(2, encode(entry.getValue()));
            written += statement.executeUpdate();
            currentBatch++;
        }

        logger.fine("Wrote " + written + " of " + entries.size() + " entries to " + path);
        return written;
    }

    private <T> T inTransaction(final String description, final CheckedFunction1<SqliteTransaction, T> work) {
        return Try.withResources(() -> SqliteTransaction.begin(jdbcUrl))
                .of(tx -> {
                    final T result = work.apply(tx);
                    tx.commit();
                    return result;
                })
                .mapFailure(
                        API.Case(API.$(instanceOf(CacheKeyNotFound.class)), ex -> ex),
                        API.Case(API.$(instanceOf(CacheValidationFailed.class)), ex -> ex),
                        API.Case(API.$(instanceOf(DeserializationFailed.class)), ex -> ex),
                        API.Case(API.$(instanceOf(LocalStorageFailure.class)), ex -> ex),
                        API.Case(API.$(), ex -> new LocalStorageFailure("Failed to " + description + " in " + path, ex)))
                .get();
    }

    private void validate(final String key, final CacheEntry entry) {
        if (key == null) {
            throw new CacheValidationFailed("Key must not be null");
        }
        if (entry == null) {
            throw new CacheValidationFailed("Value must be a CacheEntry object (got null) for key " + key);
        }
    }

    private static PreparedStatement bind(final SqliteTransaction tx, final String sql, final String... values) throws SQLException {
        final PreparedStatement statement = tx.prepare(sql);
        for (int i = 0; i < values.length; i++) {
            statement.setString(i + 1, values[i]);
        }
        return statement;
    }

    private static String encode(final CacheEntry entry) {
        return JsonCodec.serialize(entry.toMap());
    }

    private static CacheEntry decode(final String value) {
        return CacheEntry.fromMap(JsonCodec.deserializeMap(value));
    }

    @Override
    public String toString() {
        return "SqliteBackingStore(path=" + path + ")";
    }
}
