package de.bsommerfeld.gridkeeper.db.migration.fixes;

import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.InProcessDaemon;
import de.bsommerfeld.gridkeeper.db.migration.MigrationContext;
import de.bsommerfeld.gridkeeper.db.schema.ColumnSpec;
import de.bsommerfeld.gridkeeper.db.schema.SchemaWriter;
import de.bsommerfeld.gridkeeper.db.catalog.TableCatalog;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColumnRetirementTest {

    @TempDir
    Path tempDir;

    private InProcessDaemon daemon;
    private MigrationContext context;
    private SchemaWriter schema;

    @BeforeEach
    void setUp() throws Exception {
        daemon = InProcessDaemon.start(tempDir, "a.db");
        context = new MigrationContext("a.db", daemon.client(), daemon.reader());
        schema = new SchemaWriter(daemon.client(), new TableCatalog(daemon.reader()));
    }

    @AfterEach
    void tearDown() {
        daemon.close();
    }

    @Test
    void apply_shouldDropColumnAndHideItInMetadata() throws Exception {
        schema.createMainTable("a.db", "Games",
                List.of(ColumnSpec.text("Name"), ColumnSpec.integer("temp_new_row_index")), 0);

        ColumnRetirement fix = new ColumnRetirement(MigrationFixes.RETIRE_TEMP_NEW_ROW_INDEX, "temp_new_row_index");
        fix.apply(context);

        try (Connection conn = daemon.reader().getConnection("a.db")) {
            List<String> columns = DatabaseReader.columns(conn, "Games");
            assertFalse(columns.contains("temp_new_row_index"));
            assertFalse(columns.contains("_obsolete_temp_new_row_index"));
            assertEquals(1, DatabaseReader.queryLong(conn,
                    "SELECT deleted FROM Games_Metadata WHERE column_name = 'temp_new_row_index'"));
            assertEquals(0, DatabaseReader.queryLong(conn,
                    "SELECT deleted FROM Games_Metadata WHERE column_name = 'Name'"));
        }
    }

    @Test
    void apply_shouldRenameWhenDropIsRefused() throws Exception {
        schema.createMainTable("a.db", "Games", List.of(ColumnSpec.integer("temp_new_row_index")), 0);
        // an indexed column cannot be dropped
        context.exec(List.of(Statement.of("CREATE INDEX idx_tmp ON Games(temp_new_row_index)")));

        new ColumnRetirement("retire_2025_01_01", "temp_new_row_index").apply(context);

        try (Connection conn = daemon.reader().getConnection("a.db")) {
            List<String> columns = DatabaseReader.columns(conn, "Games");
            assertFalse(columns.contains("temp_new_row_index"));
            assertTrue(columns.contains("_obsolete_temp_new_row_index"));
        }
    }

    @Test
    void apply_shouldNoOpWhenColumnIsAlreadyGone() throws Exception {
        schema.createMainTable("a.db", "Games", List.of(ColumnSpec.text("Name")), 0);

        new ColumnRetirement("retire_2025_01_01", "temp_new_row_index").apply(context);

        try (Connection conn = daemon.reader().getConnection("a.db")) {
            assertEquals(List.of("id", "row_index", "Name"), DatabaseReader.columns(conn, "Games"));
        }
    }

    @Test
    void supportsDropColumn_shouldCompareMinorVersion() {
        assertTrue(ColumnRetirement.supportsDropColumn("3.35.0"));
        assertTrue(ColumnRetirement.supportsDropColumn("3.46.1"));
        assertFalse(ColumnRetirement.supportsDropColumn("3.34.1"));
        assertTrue(ColumnRetirement.supportsDropColumn("4.0"));
        assertFalse(ColumnRetirement.supportsDropColumn("garbage"));
    }

    @Test
    void standard_shouldListFixesInReleaseOrder() {
        assertEquals(List.of(MetadataColumnIndexRepair.ID, SequentialRowIndexRepair.ID,
                        MigrationFixes.RETIRE_TEMP_NEW_ROW_INDEX),
                MigrationFixes.standard().stream().map(f -> f.id()).toList());
    }
}
