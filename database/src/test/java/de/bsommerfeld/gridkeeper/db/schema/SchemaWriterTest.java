package de.bsommerfeld.gridkeeper.db.schema;

import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.InProcessDaemon;
import de.bsommerfeld.gridkeeper.db.catalog.TableCatalog;
import de.bsommerfeld.gridkeeper.db.catalog.TableHierarchy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaWriterTest {

    @TempDir
    Path tempDir;

    private InProcessDaemon daemon;
    private SchemaWriter writer;
    private TableCatalog catalog;

    @BeforeEach
    void setUp() throws Exception {
        daemon = InProcessDaemon.start(tempDir, "a.db");
        catalog = new TableCatalog(daemon.reader());
        writer = new SchemaWriter(daemon.client(), catalog);
    }

    @AfterEach
    void tearDown() {
        daemon.close();
    }

    @Test
    void createMainTable_shouldCreateTableCatalogRowAndMetadata() throws Exception {
        writer.createMainTable("a.db", "Games", List.of(ColumnSpec.text("Name"), ColumnSpec.text("Platforms")), 0);

        try (Connection conn = daemon.reader().getConnection("a.db")) {
            assertEquals(List.of("id", "row_index", "Name", "Platforms"), DatabaseReader.columns(conn, "Games"));
            assertEquals(List.of("Name", "Platforms"),
                    DatabaseReader.queryStrings(conn, "SELECT column_name FROM Games_Metadata ORDER BY column_index"));
            assertEquals(1, DatabaseReader.queryLong(conn,
                    "SELECT column_index FROM Games_Metadata WHERE column_name = 'Platforms'"));
        }
        assertTrue(catalog.load("a.db").contains("Games"));
    }

    @Test
    void createStructureTable_shouldAddGrandParentColumnsByDepth() throws Exception {
        writer.createMainTable("a.db", "Games", List.of(ColumnSpec.text("Platforms")), 0);
        String platforms = writer.createStructureTable("a.db", "Games", "Platforms", List.of(ColumnSpec.text("Store")));
        String store = writer.createStructureTable("a.db", platforms, "Store", List.of(ColumnSpec.text("Region")));

        assertEquals("Games_Platforms", platforms);
        assertEquals("Games_Platforms_Store", store);
        try (Connection conn = daemon.reader().getConnection("a.db")) {
            assertEquals(List.of("id", "row_index", "parent_key", "Store"),
                    DatabaseReader.columns(conn, platforms));
            assertEquals(List.of("id", "row_index", "parent_key", "grand_1_parent", "Region"),
                    DatabaseReader.columns(conn, store));
        }

        TableHierarchy hierarchy = catalog.load("a.db");
        assertEquals(platforms, hierarchy.parentOf(store));
        assertEquals(2, hierarchy.depthOf(store));
    }

    @Test
    void createStructureTable_shouldRejectUnknownParent() {
        assertThrows(IllegalArgumentException.class,
                () -> writer.createStructureTable("a.db", "Nope", "Col", List.of()));
    }

    @Test
    void addColumn_shouldBeIdempotent() throws Exception {
        writer.createMainTable("a.db", "Games", List.of(ColumnSpec.text("Name")), 0);

        assertTrue(writer.addColumn("a.db", "Games", ColumnSpec.integer("Year")));
        assertFalse(writer.addColumn("a.db", "Games", ColumnSpec.integer("Year")));

        try (Connection conn = daemon.reader().getConnection("a.db")) {
            assertEquals(1, DatabaseReader.queryLong(conn,
                    "SELECT COUNT(*) FROM Games_Metadata WHERE column_name = 'Year'"));
            assertEquals("Integer", DatabaseReader.queryStrings(conn,
                    "SELECT data_type FROM Games_Metadata WHERE column_name = 'Year'").get(0));
        }
    }

    @Test
    void softDeleteColumn_shouldKeepDataColumn() throws Exception {
        writer.createMainTable("a.db", "Games", List.of(ColumnSpec.text("Name"), ColumnSpec.text("Old")), 0);

        writer.softDeleteColumn("a.db", "Games", "Old");

        try (Connection conn = daemon.reader().getConnection("a.db")) {
            assertEquals(1, DatabaseReader.queryLong(conn,
                    "SELECT deleted FROM Games_Metadata WHERE column_name = 'Old'"));
            assertTrue(DatabaseReader.columns(conn, "Games").contains("Old"));
        }
    }

    @Test
    void ensureCatalog_shouldBeRepeatable() throws Exception {
        writer.ensureCatalog("a.db");
        writer.ensureCatalog("a.db");

        try (Connection conn = daemon.reader().getConnection("a.db")) {
            assertTrue(DatabaseReader.tableExists(conn, TableCatalog.CATALOG_TABLE));
        }
        assertTrue(catalog.load("a.db").tables().isEmpty());
    }
}
