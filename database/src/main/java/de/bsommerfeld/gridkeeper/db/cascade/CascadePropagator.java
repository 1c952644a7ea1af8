package de.bsommerfeld.gridkeeper.db.cascade;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.gridkeeper.client.BatchResult;
import de.bsommerfeld.gridkeeper.client.DaemonClient;
import de.bsommerfeld.gridkeeper.client.DaemonException;
import de.bsommerfeld.gridkeeper.client.DaemonSqlException;
import de.bsommerfeld.gridkeeper.client.ErrorClass;
import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.catalog.TableCatalog;
import de.bsommerfeld.gridkeeper.db.catalog.TableHierarchy;
import de.bsommerfeld.gridkeeper.db.schema.SchemaWriter;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static de.bsommerfeld.gridkeeper.protocol.SqlIdentifiers.quote;

/**
 * Rewrites denormalized ancestor references after a column rename.
 *
 * <p>
 * Structure tables store the name of the column they hang off as plain text:
 * direct children in {@code parent_key}, deeper descendants in their
 * {@code grand_N_parent} columns. When a column of {@code parentTable} is
 * renamed from {@code oldName} to {@code newName}, every such value equal to
 * {@code oldName} anywhere below {@code parentTable} becomes {@code newName}.
 * Column names never change, only stored values.
 *
 * <p>
 * The whole subtree is rewritten in one atomic batch. A second run with the
 * same arguments finds nothing left to change.
 */
@Singleton
public class CascadePropagator {

    private static final Logger LOG = LoggerFactory.getLogger(CascadePropagator.class);

    private final DatabaseReader reader;
    private final DaemonClient daemon;

    @Inject
    public CascadePropagator(DatabaseReader reader, DaemonClient daemon) {
        this.reader = reader;
        this.daemon = daemon;
    }

    public CascadeReport propagate(String database, String parentTable, String oldName, String newName)
            throws SQLException, DaemonException {
        if (oldName.equals(newName))
            return CascadeReport.empty();

        List<Statement> batch = new ArrayList<>();
        Map<String, Long> changes = new LinkedHashMap<>();

        try (Connection conn = reader.getConnection(database)) {
            TableHierarchy hierarchy = TableCatalog.load(conn);
            List<String> children = hierarchy.childrenOf(parentTable);

            for (String table : hierarchy.descendantsOf(parentTable)) {
                List<String> targets = targetColumns(DatabaseReader.columns(conn, table),
                        children.contains(table));
                for (String column : targets) {
                    String where = " WHERE " + quote(column) + " = ?";
                    long matches = DatabaseReader.queryLong(conn,
                            "SELECT COUNT(*) FROM " + quote(table) + where, oldName);
                    if (matches == 0)
                        continue;
                    batch.add(Statement.of("UPDATE " + quote(table) + " SET " + quote(column) + " = ?" + where,
                            newName, oldName));
                    changes.merge(table, matches, Long::sum);
                }
            }
        }

        if (batch.isEmpty()) {
            LOG.debug("Nothing below {} references {}", parentTable, oldName);
            return CascadeReport.empty();
        }

        BatchResult result = daemon.execBatch(batch, database);
        if (!result.isSuccess())
            throw new DaemonSqlException(result.detail(), null, ErrorClass.MISSING_METADATA_TABLE);

        LOG.info("Renamed references {} -> {} below {}: {} row(s) in {}", oldName, newName, parentTable,
                result.rowsAffected(), changes.keySet());
        return new CascadeReport(changes, result.rowsAffected());
    }

    /**
     * {@code parent_key} for direct children, every {@code grand_N_parent}
     * column for deeper descendants.
     */
    private static List<String> targetColumns(List<String> columns, boolean directChild) {
        if (directChild)
            return columns.contains(SchemaWriter.PARENT_KEY) ? List.of(SchemaWriter.PARENT_KEY) : List.of();
        List<String> targets = new ArrayList<>();
        for (String column : columns) {
            if (SchemaWriter.GRAND_PARENT_COLUMN.matcher(column).matches())
                targets.add(column);
        }
        return targets;
    }
}
