package responsecache.domain.persist;

import io.vavr.control.Try;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.logging.Logger;

/**
 * A connection with an open transaction. Closing it rolls back anything that was not committed and then closes
 * the connection, so a failed operation never leaves a half written row behind.
 */
public class SqliteTransaction implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(SqliteTransaction.class.getName());

    private final Connection connection;

    private SqliteTransaction(final Connection connection) {
        this.connection = connection;
    }

    public static SqliteTransaction begin(final String jdbcUrl) throws SQLException {
        final Connection connection = DriverManager.getConnection(jdbcUrl);
        try {
            connection.setAutoCommit(false);
            return new SqliteTransaction(connection);
        } catch (final SQLException ex) {
            connection.close();
            throw ex;
        }
    }

    public PreparedStatement prepare(final String sql) throws SQLException {
        return connection.prepareStatement(sql);
    }

    /**
     * Commit the work done so far. The transaction stays usable, which is how batched writes commit every
     * few rows on a single connection.
     */
    public void commit() throws SQLException {
        connection.commit();
    }

    @Override
    public void close() throws SQLException {
        try {
            // A no-op when everything was committed
            Try.run(connection::rollback)
                    .onFailure(ex -> logger.warning("Failed to roll back SQLite transaction: " + ex.getMessage()));
        } finally {
            connection.close();
        }
    }
}
