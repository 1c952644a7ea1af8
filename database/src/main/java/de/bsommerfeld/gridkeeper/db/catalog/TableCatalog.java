package de.bsommerfeld.gridkeeper.db.catalog;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.SqlLoader;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the {@code _Metadata} catalog of a database.
 */
@Singleton
public class TableCatalog {

    public static final String CATALOG_TABLE = "_Metadata";

    private final DatabaseReader reader;

    @Inject
    public TableCatalog(DatabaseReader reader) {
        this.reader = reader;
    }

    /**
     * Loads the catalog of {@code database}. A database without a catalog
     * yields an empty hierarchy.
     */
    public TableHierarchy load(String database) throws SQLException {
        try (Connection conn = reader.getConnection(database)) {
            return load(conn);
        }
    }

    public static TableHierarchy load(Connection conn) throws SQLException {
        if (!DatabaseReader.tableExists(conn, CATALOG_TABLE))
            return TableHierarchy.empty();

        List<TableDescriptor> rows = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("select-catalog"))) {
            while (rs.next()) {
                rows.add(new TableDescriptor(
                        rs.getString("table_name"),
                        TableType.fromDb(rs.getString("table_type")),
                        rs.getString("parent_table"),
                        rs.getString("parent_column"),
                        rs.getInt("display_order"),
                        rs.getInt("hidden") != 0));
            }
        }
        return TableHierarchy.of(rows);
    }
}
