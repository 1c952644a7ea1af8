package de.bsommerfeld.gridkeeper.db.migration;

import de.bsommerfeld.gridkeeper.client.DaemonException;
import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.SqlLoader;
import de.bsommerfeld.gridkeeper.protocol.Statement;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Persists applied fix ids in {@code _MigrationFixes}.
 */
public final class FixTracker {

    public static final String TRACKING_TABLE = "_MigrationFixes";

    private FixTracker() {
    }

    /** A missing tracking table means nothing has been applied yet. */
    public static boolean isApplied(MigrationContext context, String fixId) throws SQLException {
        try (Connection conn = context.openReadConnection()) {
            if (!DatabaseReader.tableExists(conn, TRACKING_TABLE))
                return false;
            return DatabaseReader.queryLong(conn, SqlLoader.load("count-applied-fix"), fixId) > 0;
        }
    }

    public static void markApplied(MigrationContext context, String fixId, String description)
            throws DaemonException {
        context.exec(List.of(
                Statement.of(SqlLoader.load("create-migration-fixes")),
                Statement.of(SqlLoader.load("insert-migration-fix"), fixId, description)));
    }
}
