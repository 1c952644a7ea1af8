package de.bsommerfeld.gridkeeper.daemon;

import de.bsommerfeld.gridkeeper.client.BatchResult;
import de.bsommerfeld.gridkeeper.client.DaemonClient;
import de.bsommerfeld.gridkeeper.client.DaemonSqlException;
import de.bsommerfeld.gridkeeper.client.DaemonUnavailableException;
import de.bsommerfeld.gridkeeper.client.DatabaseNameResolver;
import de.bsommerfeld.gridkeeper.client.RequestExecutor;
import de.bsommerfeld.gridkeeper.client.transport.DaemonConnector;
import de.bsommerfeld.gridkeeper.client.transport.DaemonLauncher;
import de.bsommerfeld.gridkeeper.client.transport.UnixSocketConnector;
import de.bsommerfeld.gridkeeper.protocol.MessageCodec;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the daemon in-process on a socket inside the temp directory and talks
 * to it through the real client.
 */
class DaemonServerTest {

    @TempDir
    Path tempDir;

    private Path socket;
    private DaemonServer server;
    private DaemonClient client;

    @BeforeEach
    void setUp() throws Exception {
        socket = tempDir.resolve("gridkeeper-v1.sock");
        server = new DaemonServer(tempDir, socket, 1024 * 1024);
        server.start();
        client = clientFor(socket);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private DaemonClient clientFor(Path socketPath) {
        DaemonLauncher noLaunch = new DaemonLauncher(tempDir.resolve("missing-daemon.jar"), tempDir, socketPath);
        DaemonConnector connector = new DaemonConnector(new UnixSocketConnector(socketPath), noLaunch,
                2, 0, 0, millis -> {
                });
        return new DaemonClient(connector, new RequestExecutor(new MessageCodec(1024 * 1024)),
                new DatabaseNameResolver(tempDir, "a.db"), millis -> {
                }, 0);
    }

    private long countRows(String table) throws Exception {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + tempDir.resolve("a.db"));
                ResultSet rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Test
    void execBatch_shouldCommitAtomically() throws Exception {
        client.execBatch(List.of(Statement.of("CREATE TABLE T (id INTEGER PRIMARY KEY, v TEXT UNIQUE)")));

        BatchResult ok = client.execBatch(List.of(
                Statement.of("INSERT INTO T (v) VALUES (?)", "a"),
                Statement.of("INSERT INTO T (v) VALUES (?)", "b")));
        assertEquals(2, ok.rowsAffected());

        assertThrows(DaemonSqlException.class, () -> client.execBatch(List.of(
                Statement.of("INSERT INTO T (v) VALUES (?)", "c"),
                Statement.of("INSERT INTO T (v) VALUES (?)", "a"))));

        assertEquals(2, countRows("T"));
    }

    @Test
    void execBatch_shouldAcceptRepeatedColumnAdd() throws Exception {
        client.execBatch(List.of(Statement.of("CREATE TABLE T (id INTEGER PRIMARY KEY)")), "a.db");
        List<Statement> add = List.of(Statement.of("ALTER TABLE \"T\" ADD COLUMN x TEXT"));

        assertEquals(BatchResult.Outcome.APPLIED, client.execBatch(add, "a.db").outcome());
        assertEquals(BatchResult.Outcome.ALREADY_APPLIED, client.execBatch(add, "a.db").outcome());
    }

    @Test
    void execBatch_shouldDeferMissingMetadataTable() throws Exception {
        BatchResult result = client.execBatch(List.of(
                Statement.of("INSERT INTO \"Games_Metadata\" (column_name) VALUES ('x')")));

        assertEquals(BatchResult.Outcome.DEFERRED, result.outcome());
    }

    @Test
    void execBatch_shouldSerializeConcurrentClients() throws Exception {
        client.execBatch(List.of(Statement.of("CREATE TABLE C (n INTEGER)")));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<BatchResult>> tasks = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                int n = i;
                tasks.add(() -> clientFor(socket).execBatch(List.of(Statement.of("INSERT INTO C VALUES (?)", n))));
            }
            for (Future<BatchResult> f : pool.invokeAll(tasks)) {
                assertEquals(1, f.get().rowsAffected());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(20, countRows("C"));
    }

    @Test
    void closeDatabase_shouldRejectWritesUntilReopened() throws Exception {
        client.execBatch(List.of(Statement.of("CREATE TABLE T (v TEXT)")));
        assertTrue(client.prepareForMaintenance("a.db"));
        client.closeDatabase("a.db");

        DaemonSqlException e = assertThrows(DaemonSqlException.class,
                () -> client.execBatch(List.of(Statement.of("INSERT INTO T VALUES ('x')"))));
        assertTrue(e.getMessage().contains("closed"));

        client.reopenDatabase("a.db");
        assertEquals(1, client.execBatch(List.of(Statement.of("INSERT INTO T VALUES ('x')"))).rowsAffected());
    }

    @Test
    void withSafeFileOperation_shouldReopenUnderNewName() throws Exception {
        client.execBatch(List.of(Statement.of("CREATE TABLE T (v TEXT)"),
                Statement.of("INSERT INTO T VALUES ('kept')")));

        client.withSafeFileOperation("a.db",
                () -> Files.move(tempDir.resolve("a.db"), tempDir.resolve("b.db")), "b.db");

        assertFalse(Files.exists(tempDir.resolve("a.db")));
        BatchResult result = client.execBatch(List.of(Statement.of("INSERT INTO T VALUES ('more')")), "b.db");
        assertEquals(1, result.rowsAffected());
    }

    @Test
    void ping_shouldAnswerForAnyName() {
        assertTrue(client.ping(null));
        assertTrue(client.ping(DaemonClient.HEALTH_CHECK_DATABASE));
    }

    @Test
    void disconnect_shouldLeaveDaemonRunning() throws Exception {
        client.disconnect();

        assertFalse(server.isStopped());
        assertTrue(client.ping(null));
    }

    @Test
    void shutdownDaemon_shouldStopServerAndRemoveSocket() throws Exception {
        client.execBatch(List.of(Statement.of("CREATE TABLE T (v TEXT)")));

        assertTrue(client.shutdownDaemon());
        server.awaitTermination();

        assertFalse(Files.exists(socket));
        // the next write would have to auto-start a daemon; the test executable does not exist
        DaemonUnavailableException e = assertThrows(DaemonUnavailableException.class,
                () -> client.execBatch(List.of(Statement.of("INSERT INTO T VALUES ('x')"))));
        assertTrue(e.getMessage().contains("executable not found"));
    }

    @Test
    void start_shouldRefuseSecondDaemonOnLiveSocket() {
        DaemonServer second = new DaemonServer(tempDir, socket, 1024);

        assertThrows(DaemonAlreadyRunningException.class, second::start);
    }

    @Test
    void start_shouldReplaceStaleSocketFile() throws Exception {
        Path staleSocket = tempDir.resolve("stale-v1.sock");
        Files.createFile(staleSocket);

        DaemonServer fresh = new DaemonServer(tempDir, staleSocket, 1024 * 1024);
        try {
            fresh.start();
            assertTrue(clientFor(staleSocket).ping(null));
        } finally {
            fresh.stop();
        }
    }
}
