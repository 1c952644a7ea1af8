package de.bsommerfeld.gridkeeper.db.migration.fixes;

import de.bsommerfeld.gridkeeper.client.DaemonException;
import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.catalog.TableCatalog;
import de.bsommerfeld.gridkeeper.db.catalog.TableDescriptor;
import de.bsommerfeld.gridkeeper.db.migration.MigrationContext;
import de.bsommerfeld.gridkeeper.db.migration.MigrationFix;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import static de.bsommerfeld.gridkeeper.protocol.SqlIdentifiers.quote;

/**
 * Renumbers {@code row_index} densely from 0 in row creation order for every
 * catalogued table that has duplicates or gaps. Live rows come first;
 * soft-deleted rows (where a {@code deleted} column exists) continue the
 * sequence.
 *
 * <p>
 * {@code row_index} is usually {@code UNIQUE}, so the batch first moves every
 * value below the current minimum and only then assigns the final numbers.
 */
public final class SequentialRowIndexRepair implements MigrationFix {

    private static final Logger LOG = LoggerFactory.getLogger(SequentialRowIndexRepair.class);

    public static final String ID = "sequential_row_index_2025_10_12";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Reassign row_index sequentially to remove duplicates and gaps";
    }

    @Override
    public void apply(MigrationContext context) throws SQLException, DaemonException {
        int fixed = 0;
        int skipped = 0;
        try (Connection conn = context.openReadConnection()) {
            for (TableDescriptor table : TableCatalog.load(conn).tables()) {
                List<String> columns = DatabaseReader.columns(conn, table.name());
                if (!columns.contains("row_index")) {
                    skipped++;
                    continue;
                }
                String t = quote(table.name());
                long rows = DatabaseReader.queryLong(conn, "SELECT COUNT(*) FROM " + t);
                long duplicates = DatabaseReader.queryLong(conn,
                        "SELECT COUNT(*) FROM (SELECT row_index FROM " + t
                                + " GROUP BY row_index HAVING COUNT(*) > 1)");
                if (isSequential(conn, t, rows, duplicates)) {
                    skipped++;
                    continue;
                }

                long offset = DatabaseReader.queryLong(conn,
                        "SELECT COALESCE(MAX(ABS(row_index)), 0) + 1 FROM " + t);
                LOG.info("Renumbering {}: {} row(s), {} duplicated value(s)", table.name(), rows, duplicates);
                context.exec(renumber(t, columns.contains("deleted"), offset));
                fixed++;
            }
        }
        LOG.info("Row index repair finished: {} table(s) renumbered, {} skipped", fixed, skipped);
    }

    private static boolean isSequential(Connection conn, String t, long rows, long duplicates)
            throws SQLException {
        if (rows == 0)
            return true;
        if (duplicates > 0)
            return false;
        long nulls = DatabaseReader.queryLong(conn, "SELECT COUNT(*) FROM " + t + " WHERE row_index IS NULL");
        long min = DatabaseReader.queryLong(conn, "SELECT MIN(row_index) FROM " + t);
        long max = DatabaseReader.queryLong(conn, "SELECT MAX(row_index) FROM " + t);
        return nulls == 0 && min >= 0 && max == rows - 1;
    }

    static List<Statement> renumber(String t, boolean hasDeleted, long offset) {
        String live = hasDeleted ? "COALESCE(deleted, 0) = 0" : "1 = 1";
        String dead = hasDeleted ? "COALESCE(deleted, 0) <> 0" : "1 = 0";
        return List.of(
                Statement.of("UPDATE " + t + " SET row_index = -rowid - ?", offset),
                Statement.of("UPDATE " + t + " SET row_index = (SELECT COUNT(*) FROM " + t + " AS o"
                        + " WHERE (" + live.replace("deleted", "o.deleted") + ") AND o.rowid < " + t + ".rowid)"
                        + " WHERE " + live),
                Statement.of("UPDATE " + t + " SET row_index = (SELECT COUNT(*) FROM " + t + " WHERE " + live + ")"
                        + " + (SELECT COUNT(*) FROM " + t + " AS o"
                        + " WHERE (" + dead.replace("deleted", "o.deleted") + ") AND o.rowid < " + t + ".rowid)"
                        + " WHERE " + dead));
    }
}
