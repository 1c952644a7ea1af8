package de.bsommerfeld.gridkeeper.db.migration.fixes;

import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.InProcessDaemon;
import de.bsommerfeld.gridkeeper.db.migration.MigrationContext;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetadataColumnIndexRepairTest {

    @TempDir
    Path tempDir;

    private InProcessDaemon daemon;
    private MigrationContext context;

    @BeforeEach
    void setUp() throws Exception {
        daemon = InProcessDaemon.start(tempDir, "a.db");
        context = new MigrationContext("a.db", daemon.client(), daemon.reader());
    }

    @AfterEach
    void tearDown() {
        daemon.close();
    }

    @Test
    void apply_shouldRebuildCorruptedTableWithDenseIndices() throws Exception {
        // legacy layout without constraints, column_index partly stored as text
        context.exec(List.of(
                Statement.of("CREATE TABLE Ships_Metadata (column_index, column_name TEXT, data_type TEXT,"
                        + " deleted INTEGER DEFAULT 0)"),
                Statement.of("INSERT INTO Ships_Metadata VALUES ('zero', 'Name', 'String', 0)"),
                Statement.of("INSERT INTO Ships_Metadata VALUES (7, 'Old', NULL, 1)"),
                Statement.of("INSERT INTO Ships_Metadata VALUES ('2', 'Speed', 'Integer', 0)"),
                Statement.of("CREATE TABLE Clean_Metadata (column_index INTEGER, column_name TEXT)"),
                Statement.of("INSERT INTO Clean_Metadata VALUES (5, 'Kept')")));

        new MetadataColumnIndexRepair().apply(context);

        try (Connection conn = daemon.reader().getConnection("a.db")) {
            assertEquals(List.of("Name", "Speed", "Old"), DatabaseReader.queryStrings(conn,
                    "SELECT column_name FROM Ships_Metadata ORDER BY column_index"));
            assertEquals(List.of("0", "1", "2"), DatabaseReader.queryStrings(conn,
                    "SELECT CAST(column_index AS TEXT) FROM Ships_Metadata ORDER BY column_index"));
            assertEquals(0, DatabaseReader.queryLong(conn,
                    "SELECT COUNT(*) FROM Ships_Metadata WHERE typeof(column_index) <> 'integer'"));
            assertEquals("String", DatabaseReader.queryStrings(conn,
                    "SELECT data_type FROM Ships_Metadata WHERE column_name = 'Old'").get(0));
            assertTrue(DatabaseReader.columns(conn, "Ships_Metadata").contains("ai_include_in_send"));
            // untouched
            assertEquals(List.of("column_index", "column_name"), DatabaseReader.columns(conn, "Clean_Metadata"));
        }
    }

    @Test
    void apply_shouldDoNothingWhenAllIndicesAreIntegers() throws Exception {
        context.exec(List.of(
                Statement.of("CREATE TABLE Ok_Metadata (column_index INTEGER, column_name TEXT)"),
                Statement.of("INSERT INTO Ok_Metadata VALUES (3, 'A')")));

        new MetadataColumnIndexRepair().apply(context);

        try (Connection conn = daemon.reader().getConnection("a.db")) {
            assertEquals(3, DatabaseReader.queryLong(conn, "SELECT column_index FROM Ok_Metadata"));
        }
    }

    @Test
    void apply_shouldLeaveTableIntactWhenRebuildFails() throws Exception {
        // duplicate names violate the canonical UNIQUE constraint
        context.exec(List.of(
                Statement.of("CREATE TABLE Dup_Metadata (column_index, column_name TEXT)"),
                Statement.of("INSERT INTO Dup_Metadata VALUES ('x', 'Same')"),
                Statement.of("INSERT INTO Dup_Metadata VALUES ('y', 'Same')")));

        assertThrows(Exception.class, () -> new MetadataColumnIndexRepair().apply(context));

        try (Connection conn = daemon.reader().getConnection("a.db")) {
            assertEquals(List.of("x", "y"), DatabaseReader.queryStrings(conn,
                    "SELECT column_index FROM Dup_Metadata ORDER BY rowid"));
        }
    }
}
