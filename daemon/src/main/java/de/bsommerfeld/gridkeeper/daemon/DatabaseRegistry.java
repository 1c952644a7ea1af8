package de.bsommerfeld.gridkeeper.daemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The daemon's write handles, one per database file in the data directory.
 *
 * <p>
 * Handles are opened lazily on first use in WAL mode with
 * {@code synchronous=NORMAL}. A name closed through {@link #close} stays
 * unusable until {@link #reopen}; requests against it fail instead of silently
 * reopening the file.
 *
 * <p>
 * Not thread-safe. Confined to the daemon's writer thread.
 */
class DatabaseRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseRegistry.class);

    private static final int BUSY_TIMEOUT_MILLIS = 5_000;

    private final Path dataDirectory;
    private final Map<String, Connection> open = new LinkedHashMap<>();
    private final Set<String> closed = new HashSet<>();

    DatabaseRegistry(Path dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    /**
     * Returns the write handle for {@code name}, opening it if needed.
     *
     * @throws IllegalArgumentException if {@code name} is not a plain file name
     * @throws SQLException             if the database is closed or cannot be opened
     */
    Connection connection(String name) throws SQLException {
        validate(name);
        if (closed.contains(name))
            throw new SQLException("Database " + name + " is closed; reopen it first");

        Connection conn = open.get(name);
        if (conn != null && !conn.isClosed())
            return conn;

        conn = openHandle(name);
        open.put(name, conn);
        return conn;
    }

    /**
     * Runs a RESTART checkpoint on the open handle.
     *
     * @return {@code true} if the checkpoint completed, {@code false} if it was
     *         blocked by a reader or no handle is open
     */
    boolean checkpoint(String name) throws SQLException {
        Connection conn = connection(name);
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("PRAGMA wal_checkpoint(RESTART)")) {
            if (!rs.next())
                return false;
            boolean busy = rs.getInt(1) != 0;
            if (busy)
                LOG.warn("Checkpoint of {} was blocked by a reader", name);
            return !busy;
        }
    }

    /**
     * Checkpoints and releases the handle. The name is marked closed even if
     * no handle was open.
     */
    void close(String name) throws SQLException {
        validate(name);
        Connection conn = open.remove(name);
        closed.add(name);
        if (conn == null || conn.isClosed())
            return;
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA wal_checkpoint(RESTART)");
        } finally {
            conn.close();
        }
        LOG.info("Closed {}", name);
    }

    /** Clears the closed mark and opens {@code name}. */
    void reopen(String name) throws SQLException {
        validate(name);
        closed.remove(name);
        connection(name);
        LOG.info("Reopened {}", name);
    }

    boolean isClosed(String name) {
        return closed.contains(name);
    }

    boolean isOpen(String name) {
        return open.containsKey(name);
    }

    /** Checkpoints and closes every handle. Failures are logged per file. */
    void closeAll() {
        for (Map.Entry<String, Connection> entry : open.entrySet()) {
            try (Connection conn = entry.getValue(); Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA wal_checkpoint(RESTART)");
            } catch (SQLException e) {
                LOG.error("Failed to checkpoint {} on shutdown: {}", entry.getKey(), e.getMessage());
            }
        }
        open.clear();
    }

    private Connection openHandle(String name) throws SQLException {
        Path file = dataDirectory.resolve(name);
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MILLIS);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        LOG.info("Opened write handle for {}", file);
        return conn;
    }

    /** Plain file names only: no separators, no parent references. */
    static void validate(String name) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Database name must not be empty");
        if (name.contains("/") || name.contains("\\") || name.contains("..") || name.indexOf('\0') >= 0)
            throw new IllegalArgumentException("Invalid database name: " + name);
    }
}
