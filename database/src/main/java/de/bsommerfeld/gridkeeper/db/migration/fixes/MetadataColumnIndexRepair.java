package de.bsommerfeld.gridkeeper.db.migration.fixes;

import de.bsommerfeld.gridkeeper.client.DaemonException;
import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.SqlLoader;
import de.bsommerfeld.gridkeeper.db.migration.MigrationContext;
import de.bsommerfeld.gridkeeper.db.migration.MigrationFix;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static de.bsommerfeld.gridkeeper.protocol.SqlIdentifiers.quote;

/**
 * Rebuilds every {@code <table>_Metadata} whose {@code column_index} holds
 * something other than integers (text, reals or NULL).
 *
 * <p>
 * Per affected table, one batch copies the rows into a temporary backup,
 * drops and recreates the table with the canonical schema, reinserts live
 * columns numbered from 0 in row order, appends soft-deleted columns after
 * them and drops the backup. A failure rolls the whole table back.
 */
public final class MetadataColumnIndexRepair implements MigrationFix {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataColumnIndexRepair.class);

    public static final String ID = "repair_metadata_column_index_2025_11_03";

    private static final String BACKUP = "temp._column_index_backup";

    /** Canonical columns copied from the backup, except {@code column_index}. */
    private static final List<String> COPIED_COLUMNS = List.of(
            "id", "column_name", "display_name", "data_type", "validator_type", "validator_config",
            "ai_context", "filter_expr", "ai_enable_row_generation", "ai_include_in_send", "deleted");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Rebuild column metadata tables whose column_index holds non-integer values";
    }

    @Override
    public void apply(MigrationContext context) throws SQLException, DaemonException {
        List<String> repaired = new ArrayList<>();
        try (Connection conn = context.openReadConnection()) {
            for (String metaTable : DatabaseReader.queryStrings(conn, SqlLoader.load("select-metadata-tables"))) {
                long wrongTyped = DatabaseReader.queryLong(conn,
                        "SELECT COUNT(*) FROM " + quote(metaTable) + " WHERE typeof(column_index) <> 'integer'");
                if (wrongTyped == 0)
                    continue;

                LOG.info("Repairing {}: {} row(s) with a non-integer column_index", metaTable, wrongTyped);
                context.exec(rebuild(metaTable, DatabaseReader.columns(conn, metaTable)));
                repaired.add(metaTable);
            }
        }
        LOG.info("Column index repair finished, {} table(s) rebuilt: {}", repaired.size(), repaired);
    }

    static List<Statement> rebuild(String metaTable, List<String> existingColumns) {
        List<String> targets = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        for (String column : COPIED_COLUMNS) {
            if (!existingColumns.contains(column))
                continue;
            targets.add(column);
            sources.add("data_type".equals(column) ? "COALESCE(data_type, 'String')" : column);
        }
        boolean hasDeleted = existingColumns.contains("deleted");
        String live = hasDeleted ? "COALESCE(deleted, 0) = 0" : "1 = 1";
        String dead = hasDeleted ? "COALESCE(deleted, 0) <> 0" : "1 = 0";

        String insertInto = "INSERT INTO " + quote(metaTable) + " (column_index, " + String.join(", ", targets) + ") ";
        String selected = String.join(", ", sources);

        List<Statement> batch = new ArrayList<>();
        batch.add(Statement.of("DROP TABLE IF EXISTS " + BACKUP));
        batch.add(Statement.of("CREATE TEMP TABLE _column_index_backup AS SELECT rowid AS _old_rowid, * FROM "
                + quote(metaTable)));
        batch.add(Statement.of("DROP TABLE " + quote(metaTable)));
        batch.add(Statement.of(SqlLoader.format("create-column-metadata", quote(metaTable))));
        batch.add(Statement.of(insertInto
                + "SELECT ROW_NUMBER() OVER (ORDER BY _old_rowid) - 1, " + selected
                + " FROM " + BACKUP + " WHERE " + live + " ORDER BY _old_rowid"));
        batch.add(Statement.of(insertInto
                + "SELECT (SELECT COUNT(*) FROM " + BACKUP + " WHERE " + live + ")"
                + " + ROW_NUMBER() OVER (ORDER BY _old_rowid) - 1, " + selected
                + " FROM " + BACKUP + " WHERE " + dead + " ORDER BY _old_rowid"));
        batch.add(Statement.of("DROP TABLE " + BACKUP));
        return batch;
    }
}
