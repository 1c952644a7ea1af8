package de.bsommerfeld.gridkeeper.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.gridkeeper.core.config.GridkeeperConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static de.bsommerfeld.gridkeeper.protocol.SqlIdentifiers.quote;

/**
 * Read-side access to the managed databases.
 *
 * <p>
 * A new {@link Connection} is opened per operation and closed by the caller.
 * Connections from here are for reading and for WAL checkpoints only; every
 * data or schema change goes through the daemon.
 */
@Singleton
public class DatabaseReader {

    private final Path dataDirectory;

    @Inject
    public DatabaseReader(GridkeeperConfig config) {
        this(config.resolveDataDirectory());
    }

    public DatabaseReader(Path dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }

    public Path resolve(String database) {
        return dataDirectory.resolve(database);
    }

    public Connection getConnection(String database) throws SQLException {
        return getConnection(resolve(database));
    }

    public Connection getConnection(Path file) throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
    }

    // =====================================================================
    // Schema Introspection
    // =====================================================================

    public static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("table-exists"))) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        }
    }

    /** Column names of {@code table} in declaration order; empty if the table does not exist. */
    public static List<String> columns(Connection conn, String table) throws SQLException {
        List<String> columns = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + quote(table) + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name"));
            }
        }
        return columns;
    }

    public static long queryLong(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    public static List<String> queryStrings(Connection conn, String sql) throws SQLException {
        List<String> values = new ArrayList<>();
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                values.add(rs.getString(1));
            }
        }
        return values;
    }
}
