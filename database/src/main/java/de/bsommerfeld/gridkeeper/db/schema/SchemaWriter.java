package de.bsommerfeld.gridkeeper.db.schema;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.gridkeeper.client.BatchResult;
import de.bsommerfeld.gridkeeper.client.DaemonClient;
import de.bsommerfeld.gridkeeper.client.DaemonException;
import de.bsommerfeld.gridkeeper.client.DaemonSqlException;
import de.bsommerfeld.gridkeeper.client.ErrorClass;
import de.bsommerfeld.gridkeeper.db.SqlLoader;
import de.bsommerfeld.gridkeeper.db.catalog.TableCatalog;
import de.bsommerfeld.gridkeeper.db.catalog.TableDescriptor;
import de.bsommerfeld.gridkeeper.db.catalog.TableHierarchy;
import de.bsommerfeld.gridkeeper.db.catalog.TableType;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static de.bsommerfeld.gridkeeper.protocol.SqlIdentifiers.quote;

/**
 * Creates and evolves tables, their catalog rows and their per-column
 * metadata. Every change is sent through the daemon; each method is one
 * atomic batch unless noted.
 *
 * <h3>Layout</h3>
 * <pre>
 * main table       id, row_index UNIQUE, &lt;data columns&gt;
 * structure table  id, row_index UNIQUE, parent_key, grand_1_parent .. grand_N_parent, &lt;data columns&gt;
 * </pre>
 * A structure table at depth {@code d} below its root carries
 * {@code grand_1_parent} up to {@code grand_(d-1)_parent}, nearest ancestor
 * first.
 */
@Singleton
public class SchemaWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaWriter.class);

    public static final String PARENT_KEY = "parent_key";
    public static final Pattern GRAND_PARENT_COLUMN = Pattern.compile("grand_\\d+_parent");

    private final DaemonClient daemon;
    private final TableCatalog catalog;

    @Inject
    public SchemaWriter(DaemonClient daemon, TableCatalog catalog) {
        this.daemon = daemon;
        this.catalog = catalog;
    }

    public static String grandParentColumn(int level) {
        return "grand_" + level + "_parent";
    }

    public void ensureCatalog(String database) throws DaemonException {
        exec(database, List.of(Statement.of(SqlLoader.load("create-catalog"))));
    }

    public void createMainTable(String database, String table, List<ColumnSpec> columns, int displayOrder)
            throws DaemonException {
        List<String> defs = new ArrayList<>();
        defs.add("id INTEGER PRIMARY KEY AUTOINCREMENT");
        defs.add("row_index INTEGER UNIQUE NOT NULL");
        columns.forEach(c -> defs.add(quote(c.name()) + " " + c.sqlType()));

        List<Statement> batch = new ArrayList<>();
        batch.add(Statement.of(SqlLoader.load("create-catalog")));
        batch.add(Statement.of("CREATE TABLE IF NOT EXISTS " + quote(table) + " (" + String.join(", ", defs) + ")"));
        batch.add(Statement.of("CREATE INDEX IF NOT EXISTS " + quote("idx_" + table + "_row_index")
                + " ON " + quote(table) + "(row_index)"));
        batch.add(Statement.of(SqlLoader.load("insert-catalog-entry"),
                table, TableType.MAIN.dbValue(), null, null, displayOrder, null));
        batch.addAll(metadataStatements(table, columns));

        exec(database, batch);
        LOG.info("Created table {} in {}", table, database);
    }

    /**
     * Creates {@code <parent>_<parentColumn>} below {@code parentTable}.
     *
     * @return the new table's name
     */
    public String createStructureTable(String database, String parentTable, String parentColumn,
            List<ColumnSpec> columns) throws DaemonException, SQLException {
        TableHierarchy hierarchy = catalog.load(database);
        if (!hierarchy.contains(parentTable))
            throw new IllegalArgumentException("Unknown parent table " + parentTable + " in " + database);

        String table = parentTable + "_" + parentColumn;
        int depth = hierarchy.depthOf(parentTable) + 1;

        List<String> defs = new ArrayList<>();
        defs.add("id INTEGER PRIMARY KEY AUTOINCREMENT");
        defs.add("row_index INTEGER UNIQUE NOT NULL");
        defs.add(PARENT_KEY + " TEXT");
        for (int level = 1; level < depth; level++) {
            defs.add(grandParentColumn(level) + " TEXT");
        }
        columns.forEach(c -> defs.add(quote(c.name()) + " " + c.sqlType()));

        List<Statement> batch = new ArrayList<>();
        batch.add(Statement.of("CREATE TABLE IF NOT EXISTS " + quote(table) + " (" + String.join(", ", defs) + ")"));
        batch.add(Statement.of("CREATE INDEX IF NOT EXISTS " + quote("idx_" + table + "_parent_key")
                + " ON " + quote(table) + "(" + PARENT_KEY + ")"));
        batch.add(Statement.of(SqlLoader.load("insert-catalog-entry"),
                table, TableType.STRUCTURE.dbValue(), parentTable, parentColumn, 0, null));
        batch.addAll(metadataStatements(table, columns));

        exec(database, batch);
        LOG.info("Created structure table {} (depth {}) in {}", table, depth, database);
        return table;
    }

    /**
     * Adds a data column and registers it in the table's metadata. Safe to
     * repeat: an existing column is left alone.
     *
     * @return {@code true} if the column was added
     */
    public boolean addColumn(String database, String table, ColumnSpec column) throws DaemonException {
        boolean added = daemon.execAlterTableAddColumn(database, table, column.name(), column.sqlType(), null);
        exec(database, List.of(registerColumn(TableDescriptor.metadataTableOf(table), column)));
        return added;
    }

    /**
     * Hides a column from every user-facing view. The data column and its
     * metadata row stay.
     */
    public void softDeleteColumn(String database, String table, String column) throws DaemonException {
        exec(database, List.of(Statement.of(
                SqlLoader.format("soft-delete-column", quote(TableDescriptor.metadataTableOf(table))), column)));
    }

    private List<Statement> metadataStatements(String table, List<ColumnSpec> columns) {
        String meta = TableDescriptor.metadataTableOf(table);
        List<Statement> statements = new ArrayList<>();
        statements.add(Statement.of(SqlLoader.format("create-column-metadata", quote(meta))));
        columns.forEach(c -> statements.add(registerColumn(meta, c)));
        return statements;
    }

    private static Statement registerColumn(String metaTable, ColumnSpec column) {
        return Statement.of(SqlLoader.format("insert-column-metadata", quote(metaTable)),
                column.name(), column.displayNameOrName(), column.dataType());
    }

    private void exec(String database, List<Statement> batch) throws DaemonException {
        BatchResult result = daemon.execBatch(batch, database);
        if (!result.isSuccess())
            throw new DaemonSqlException(result.detail(), null, ErrorClass.MISSING_METADATA_TABLE);
    }
}
