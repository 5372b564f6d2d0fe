package responsecache.domain.migration;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Writes SQLite files in the legacy single table layout.
 */
public final class LegacyCacheFixture {
    private LegacyCacheFixture() {
    }

    public static void create(final Path path, final String[]... rows) throws SQLException {
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("""
                    CREATE TABLE responses (
                    id INTEGER PRIMARY KEY,
                    model TEXT,
                    parameters TEXT,
                    system_prompt TEXT,
                    prompt TEXT,
                    output TEXT)""");

            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO responses (id, model, parameters, system_prompt, prompt, output) VALUES (?, ?, ?, ?, ?, ?)")) {
                for (final String[] row : rows) {
                    for (int i = 0; i < row.length; i++) {
                        insert.setString(i + 1, row[i]);
                    }
                    insert.executeUpdate();
                }
            }
        }
    }
}
