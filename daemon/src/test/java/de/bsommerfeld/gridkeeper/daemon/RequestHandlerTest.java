package de.bsommerfeld.gridkeeper.daemon;

import de.bsommerfeld.gridkeeper.protocol.DaemonRequest;
import de.bsommerfeld.gridkeeper.protocol.DaemonResponse;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestHandlerTest {

    @TempDir
    Path dataDir;

    private DatabaseRegistry registry;
    private RequestHandler handler;

    @BeforeEach
    void setUp() {
        registry = new DatabaseRegistry(dataDir);
        handler = new RequestHandler(registry);
        assertTrue(handler.handle(batch(
                Statement.of("CREATE TABLE t (id INTEGER PRIMARY KEY, name TEXT UNIQUE)"))).isOk());
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    private static DaemonRequest batch(Statement... statements) {
        return DaemonRequest.ExecBatch.atomic("a.db", List.of(statements));
    }

    private long count() throws Exception {
        try (java.sql.Statement stmt = registry.connection("a.db").createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM t")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Test
    void handle_shouldSumUpdateCounts() {
        DaemonResponse response = handler.handle(batch(
                Statement.of("INSERT INTO t (name) VALUES (?)", "a"),
                Statement.of("INSERT INTO t (name) VALUES (?)", "b"),
                Statement.of("UPDATE t SET name = name || '!'")));

        assertTrue(response.isOk());
        assertEquals(4L, response.rowsAffected());
    }

    @Test
    void handle_shouldRollBackWholeBatchOnError() throws Exception {
        DaemonResponse response = handler.handle(batch(
                Statement.of("INSERT INTO t (name) VALUES (?)", "a"),
                Statement.of("INSERT INTO t (name) VALUES (?)", "a")));

        assertTrue(response.isError());
        assertTrue(response.errorText().contains("UNIQUE"));
        assertTrue(response.code().startsWith("SQLITE_CONSTRAINT"));
        assertEquals(0, count());
    }

    @Test
    void handle_shouldBindNullAndBooleanParameters() throws Exception {
        DaemonResponse response = handler.handle(batch(
                Statement.of("INSERT INTO t (id, name) VALUES (?, ?)", 7, null),
                Statement.of("INSERT INTO t (name) VALUES (?)", true)));

        assertTrue(response.isOk(), response.errorText());
        assertEquals(2, count());
    }

    @Test
    void handle_shouldIncreaseRevOnEveryRequest() {
        long first = handler.handle(new DaemonRequest.Ping(null)).rev();
        long second = handler.handle(new DaemonRequest.Ping("whatever.db")).rev();

        assertTrue(second > first);
    }

    @Test
    void handle_shouldRejectRequestsOnClosedDatabase() {
        assertEquals(Boolean.TRUE, handler.handle(new DaemonRequest.CloseDatabase("a.db")).closed());

        DaemonResponse response = handler.handle(batch(Statement.of("INSERT INTO t (name) VALUES ('x')")));
        assertTrue(response.isError());
        assertTrue(response.errorText().contains("closed"));

        assertEquals(Boolean.TRUE, handler.handle(new DaemonRequest.ReopenDatabase("a.db")).reopened());
        assertTrue(handler.handle(batch(Statement.of("INSERT INTO t (name) VALUES ('x')"))).isOk());
    }

    @Test
    void handle_shouldAcknowledgeCheckpoint() {
        DaemonResponse response = handler.handle(new DaemonRequest.PrepareForMaintenance("a.db"));

        assertTrue(response.isOk());
        assertEquals(Boolean.TRUE, response.checkpointed());
    }

    @Test
    void handle_shouldRejectUnsafeDatabaseName() {
        DaemonResponse response = handler.handle(DaemonRequest.ExecBatch.atomic("../x.db",
                List.of(Statement.of("SELECT 1"))));

        assertTrue(response.isError());
        assertEquals("INVALID_REQUEST", response.code());
    }
}
