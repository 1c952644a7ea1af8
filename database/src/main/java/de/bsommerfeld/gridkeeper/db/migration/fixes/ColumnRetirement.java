package de.bsommerfeld.gridkeeper.db.migration.fixes;

import de.bsommerfeld.gridkeeper.client.DaemonException;
import de.bsommerfeld.gridkeeper.client.DaemonSqlException;
import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.catalog.TableCatalog;
import de.bsommerfeld.gridkeeper.db.catalog.TableDescriptor;
import de.bsommerfeld.gridkeeper.db.migration.MigrationContext;
import de.bsommerfeld.gridkeeper.db.migration.MigrationFix;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

import static de.bsommerfeld.gridkeeper.protocol.SqlIdentifiers.quote;

/**
 * Removes an obsolete data column from every catalogued table.
 *
 * <p>
 * SQLite 3.35 and later drop the column. Older engines, or a drop the engine
 * refuses (indexed column, for instance), rename it to
 * {@code _obsolete_<column>} instead. Both names are then soft-deleted in the
 * table's column metadata.
 */
public final class ColumnRetirement implements MigrationFix {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnRetirement.class);

    public static final String OBSOLETE_PREFIX = "_obsolete_";

    private final String id;
    private final String column;

    public ColumnRetirement(String id, String column) {
        this.id = id;
        this.column = column;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String description() {
        return "Drop or hide the obsolete column '" + column + "'";
    }

    public String obsoleteName() {
        return OBSOLETE_PREFIX + column;
    }

    @Override
    public void apply(MigrationContext context) throws SQLException, DaemonException {
        int dropped = 0;
        int renamed = 0;
        try (Connection conn = context.openReadConnection()) {
            boolean canDrop = supportsDropColumn(queryVersion(conn));
            LOG.debug("DROP COLUMN supported on {}: {}", context.database(), canDrop);

            for (TableDescriptor table : TableCatalog.load(conn).tables()) {
                String t = quote(table.name());
                if (DatabaseReader.columns(conn, table.name()).contains(column)) {
                    if (canDrop && tryDrop(context, t)) {
                        dropped++;
                    } else {
                        context.exec(List.of(Statement.of(
                                "ALTER TABLE " + t + " RENAME COLUMN " + quote(column) + " TO " + quote(obsoleteName()))));
                        renamed++;
                    }
                }
                hideInMetadata(context, conn, table);
            }
        }
        LOG.info("Retired column {} on {}: {} dropped, {} renamed", column, context.database(), dropped, renamed);
    }

    private boolean tryDrop(MigrationContext context, String table) throws DaemonException {
        try {
            context.exec(List.of(Statement.of("ALTER TABLE " + table + " DROP COLUMN " + quote(column))));
            return true;
        } catch (DaemonSqlException e) {
            LOG.warn("Could not drop {} from {}, renaming it instead: {}", column, table, e.getMessage());
            return false;
        }
    }

    private void hideInMetadata(MigrationContext context, Connection conn, TableDescriptor table)
            throws SQLException, DaemonException {
        String meta = table.metadataTable();
        if (!DatabaseReader.columns(conn, meta).contains("deleted"))
            return;
        context.exec(List.of(Statement.of(
                "UPDATE " + quote(meta) + " SET deleted = 1"
                        + " WHERE LOWER(column_name) IN (?, ?) AND COALESCE(deleted, 0) = 0",
                column.toLowerCase(Locale.ROOT), obsoleteName().toLowerCase(Locale.ROOT))));
    }

    private static String queryVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT sqlite_version()");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getString(1) : "3.0.0";
        }
    }

    /** {@code "3.35.0"} and later support {@code ALTER TABLE ... DROP COLUMN}. */
    static boolean supportsDropColumn(String version) {
        String[] parts = version.trim().split("\\.");
        int major = parseOr(parts, 0, 3);
        int minor = parseOr(parts, 1, 0);
        return major > 3 || (major == 3 && minor >= 35);
    }

    private static int parseOr(String[] parts, int index, int fallback) {
        if (index >= parts.length)
            return fallback;
        try {
            return Integer.parseInt(parts[index]);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
