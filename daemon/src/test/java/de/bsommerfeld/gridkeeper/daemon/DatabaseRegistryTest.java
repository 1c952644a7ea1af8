package de.bsommerfeld.gridkeeper.daemon;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseRegistryTest {

    @TempDir
    Path dataDir;

    private DatabaseRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DatabaseRegistry(dataDir);
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    @Test
    void connection_shouldOpenInWalMode() throws Exception {
        Connection conn = registry.connection("galaxy.db");

        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("PRAGMA journal_mode")) {
            assertTrue(rs.next());
            assertEquals("wal", rs.getString(1).toLowerCase());
        }
        assertTrue(Files.exists(dataDir.resolve("galaxy.db")));
    }

    @Test
    void connection_shouldReuseOpenHandle() throws Exception {
        assertSame(registry.connection("galaxy.db"), registry.connection("galaxy.db"));
    }

    @Test
    void connection_shouldFailLoudlyWhileClosed() throws Exception {
        registry.connection("galaxy.db");
        registry.close("galaxy.db");

        SQLException e = assertThrows(SQLException.class, () -> registry.connection("galaxy.db"));
        assertTrue(e.getMessage().contains("closed"));
        assertTrue(registry.isClosed("galaxy.db"));
        assertFalse(registry.isOpen("galaxy.db"));
    }

    @Test
    void reopen_shouldMakeDatabaseUsableAgain() throws Exception {
        registry.close("galaxy.db");
        registry.reopen("galaxy.db");

        assertFalse(registry.isClosed("galaxy.db"));
        assertNotNull(registry.connection("galaxy.db"));
    }

    @Test
    void checkpoint_shouldReportCompletedCheckpoint() throws Exception {
        try (Statement stmt = registry.connection("galaxy.db").createStatement()) {
            stmt.execute("CREATE TABLE t (a TEXT)");
            stmt.execute("INSERT INTO t VALUES ('x')");
        }

        assertTrue(registry.checkpoint("galaxy.db"));
    }

    @Test
    void validate_shouldRejectPathsOutsideDataDirectory() {
        assertThrows(IllegalArgumentException.class, () -> DatabaseRegistry.validate("../escape.db"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseRegistry.validate("sub/inner.db"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseRegistry.validate(" "));
        assertDoesNotThrow(() -> DatabaseRegistry.validate("galaxy.db"));
    }
}
