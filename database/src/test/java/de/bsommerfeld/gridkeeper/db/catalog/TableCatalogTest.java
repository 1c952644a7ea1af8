package de.bsommerfeld.gridkeeper.db.catalog;

import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.SqlLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReturnEmptyHierarchyWithoutCatalog() throws Exception {
        assertTrue(new TableCatalog(new DatabaseReader(tempDir)).load("fresh.db").tables().isEmpty());
    }

    @Test
    void load_shouldReadCatalogRows() throws Exception {
        DatabaseReader reader = new DatabaseReader(tempDir);
        try (Connection conn = reader.getConnection("a.db"); Statement stmt = conn.createStatement()) {
            stmt.execute(SqlLoader.load("create-catalog"));
            stmt.execute("INSERT INTO _Metadata (table_name, display_order) VALUES ('Games', 0)");
            stmt.execute("INSERT INTO _Metadata (table_name, table_type, parent_table, parent_column, hidden)"
                    + " VALUES ('Games_Platforms', 'structure', 'Games', 'Platforms', 1)");
        }

        TableHierarchy hierarchy = new TableCatalog(reader).load("a.db");

        assertEquals(TableType.MAIN, hierarchy.get("Games").type());
        TableDescriptor child = hierarchy.get("Games_Platforms");
        assertTrue(child.isStructure());
        assertTrue(child.hidden());
        assertEquals("Platforms", child.parentColumn());
        assertEquals(List.of("Games_Platforms"), hierarchy.childrenOf("Games"));
    }
}
