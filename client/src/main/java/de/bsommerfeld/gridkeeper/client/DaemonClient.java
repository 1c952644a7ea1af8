package de.bsommerfeld.gridkeeper.client;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.gridkeeper.client.transport.DaemonChannel;
import de.bsommerfeld.gridkeeper.client.transport.DaemonConnector;
import de.bsommerfeld.gridkeeper.client.transport.DaemonLauncher;
import de.bsommerfeld.gridkeeper.client.transport.Sleeper;
import de.bsommerfeld.gridkeeper.client.transport.UnixSocketConnector;
import de.bsommerfeld.gridkeeper.core.config.DaemonConfig;
import de.bsommerfeld.gridkeeper.core.config.GridkeeperConfig;
import de.bsommerfeld.gridkeeper.protocol.DaemonRequest;
import de.bsommerfeld.gridkeeper.protocol.DaemonResponse;
import de.bsommerfeld.gridkeeper.protocol.MessageCodec;
import de.bsommerfeld.gridkeeper.protocol.SqlIdentifiers;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Single entry point for every write against the managed databases.
 *
 * <p>
 * Each call opens its own connection (auto-starting the daemon if needed),
 * sends exactly one request and closes the connection again. The client holds
 * no state besides its identity (channel, executable, default database), so
 * one instance can be shared by all threads of a process.
 *
 * <h3>Benign daemon errors</h3>
 * <ul>
 * <li>"no such table" on a {@code _Metadata} table turns into
 * {@link BatchResult.Outcome#DEFERRED}.</li>
 * <li>"duplicate column name" turns into
 * {@link BatchResult.Outcome#ALREADY_APPLIED}, but only when every statement
 * of the batch is an {@code ALTER TABLE ... ADD COLUMN}.</li>
 * </ul>
 * Everything else is raised as {@link DaemonSqlException}.
 */
@Singleton
public class DaemonClient {

    private static final Logger LOG = LoggerFactory.getLogger(DaemonClient.class);

    /** Database name sent by {@link #ping} when nothing else resolves. */
    public static final String HEALTH_CHECK_DATABASE = "__health_check__.db";

    private static final Pattern ADD_COLUMN = Pattern.compile(
            "^\\s*ALTER\\s+TABLE\\s+.+?\\s+ADD\\s+.+", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final DaemonConnector connector;
    private final RequestExecutor executor;
    private final DatabaseNameResolver resolver;
    private final Sleeper sleeper;
    private final long fileOperationSettleMillis;

    @Inject
    public DaemonClient(GridkeeperConfig config) {
        this(createConnector(config),
                new RequestExecutor(new MessageCodec(config.getDaemon().getMaxFrameBytes())),
                new DatabaseNameResolver(config.resolveDataDirectory(), config.getStorage().getDatabaseName()),
                Sleeper.SYSTEM,
                config.getDaemon().getFileOperationSettleMillis());
    }

    public DaemonClient(DaemonConnector connector, RequestExecutor executor, DatabaseNameResolver resolver,
            Sleeper sleeper, long fileOperationSettleMillis) {
        this.connector = connector;
        this.executor = executor;
        this.resolver = resolver;
        this.sleeper = sleeper;
        this.fileOperationSettleMillis = fileOperationSettleMillis;
    }

    private static DaemonConnector createConnector(GridkeeperConfig config) {
        DaemonConfig daemon = config.getDaemon();
        Path socket = config.resolveSocketPath();
        DaemonLauncher launcher = new DaemonLauncher(
                config.resolveDaemonExecutable(), config.resolveDataDirectory(), socket);
        return new DaemonConnector(new UnixSocketConnector(socket), launcher,
                daemon.getMaxRetries(), daemon.getStartupSettleMillis(),
                daemon.getRetryBaseDelayMillis(), Sleeper.SYSTEM);
    }

    // =====================================================================
    // Writes
    // =====================================================================

    /**
     * Runs {@code statements} as one atomic batch.
     *
     * @param database target file name, or {@code null} for the default
     */
    public BatchResult execBatch(List<Statement> statements, String database) throws DaemonException {
        if (statements.isEmpty())
            return BatchResult.applied(0);

        String db = resolver.resolve(database);
        try {
            DaemonResponse response = send(DaemonRequest.ExecBatch.atomic(db, statements));
            return BatchResult.applied(response.rowsAffectedOrZero());
        } catch (DaemonSqlException e) {
            if (e.getErrorClass() == ErrorClass.MISSING_METADATA_TABLE) {
                LOG.info("Batch on {} deferred, metadata table not visible yet: {}", db, e.getMessage());
                return BatchResult.deferred(e.getMessage());
            }
            if (e.getErrorClass() == ErrorClass.DUPLICATE_COLUMN && allAddColumn(statements)) {
                LOG.debug("Column add on {} already applied: {}", db, e.getMessage());
                return BatchResult.alreadyApplied(e.getMessage());
            }
            LOG.error("Batch of {} statement(s) failed on {}: {}", statements.size(), db, e.getMessage());
            throw e;
        }
    }

    public BatchResult execBatch(List<Statement> statements) throws DaemonException {
        return execBatch(statements, null);
    }

    /**
     * Idempotent {@code ALTER TABLE ... ADD COLUMN}.
     *
     * @param defaultExpression SQL default expression, e.g. {@code 0} or
     *                          {@code ''}; {@code null} for none
     * @return {@code true} if the column was added, {@code false} if it
     *         already existed
     */
    public boolean execAlterTableAddColumn(String database, String table, String column, String type,
            String defaultExpression) throws DaemonException {
        StringBuilder sql = new StringBuilder("ALTER TABLE ")
                .append(SqlIdentifiers.quote(table))
                .append(" ADD COLUMN ")
                .append(SqlIdentifiers.quote(column))
                .append(' ').append(type);
        if (defaultExpression != null)
            sql.append(" DEFAULT ").append(defaultExpression);

        BatchResult result = execBatch(List.of(Statement.of(sql.toString())), database);
        if (result.outcome() == BatchResult.Outcome.DEFERRED)
            throw new DaemonSqlException(result.detail(), null, ErrorClass.MISSING_METADATA_TABLE);
        return result.outcome() == BatchResult.Outcome.APPLIED;
    }

    // =====================================================================
    // Maintenance
    // =====================================================================

    /**
     * Checkpoints the daemon's write-ahead log for the database. Call before
     * touching the file on disk.
     *
     * @return whether the daemon reports that a checkpoint ran
     */
    public boolean prepareForMaintenance(String database) throws DaemonException {
        DaemonResponse response = send(new DaemonRequest.PrepareForMaintenance(resolver.resolve(database)));
        return Boolean.TRUE.equals(response.checkpointed());
    }

    /** Releases the daemon's handle. Every other request on it fails until reopened. */
    public void closeDatabase(String database) throws DaemonException {
        send(new DaemonRequest.CloseDatabase(resolver.resolve(database)));
    }

    /**
     * Re-acquires the daemon's handle.
     *
     * @param newName the file's name after a rename, or {@code null} for the
     *                default database
     */
    public void reopenDatabase(String newName) throws DaemonException {
        send(new DaemonRequest.ReopenDatabase(resolver.resolve(newName)));
    }

    /**
     * Checkpoint, close, settle, run {@code operation}, reopen.
     *
     * <p>
     * The database is reopened only if every earlier step succeeded. A failed
     * checkpoint, close or operation is rethrown as-is and the handle is left
     * in whatever state that step produced.
     *
     * @param newName name to reopen under when {@code operation} renamed the
     *                file; {@code null} keeps the original name
     */
    public void withSafeFileOperation(String database, FileOperation operation, String newName)
            throws DaemonException, IOException {
        String db = resolver.resolve(database);

        prepareForMaintenance(db);
        closeDatabase(db);
        pause(fileOperationSettleMillis);

        try {
            operation.run();
        } catch (IOException | RuntimeException e) {
            LOG.error("File operation on {} failed; database stays closed: {}", db, e.getMessage());
            throw e;
        }

        reopenDatabase(newName != null ? newName : db);
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /**
     * Liveness probe. Auto-starts the daemon like any other request.
     *
     * @return {@code true} if the daemon answered without error
     */
    public boolean ping(String database) {
        String db = resolver.tryResolve(database).orElse(HEALTH_CHECK_DATABASE);
        try {
            send(new DaemonRequest.Ping(db));
            return true;
        } catch (DaemonException e) {
            LOG.warn("Daemon ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Ends this client's session. The daemon keeps running for others. A
     * daemon that is not running is not started for this.
     */
    public void disconnect() throws DaemonException {
        sendIfRunning(new DaemonRequest.Disconnect());
    }

    /**
     * Stops the daemon for every client. The next write from anyone starts
     * it again.
     *
     * @return {@code false} if no daemon was running
     */
    public boolean shutdownDaemon() throws DaemonException {
        boolean sent = sendIfRunning(new DaemonRequest.Shutdown());
        if (sent)
            LOG.info("Daemon on {} acknowledged shutdown", connector.describe());
        return sent;
    }

    public String channel() {
        return connector.describe();
    }

    public DatabaseNameResolver resolver() {
        return resolver;
    }

    // =====================================================================
    // Internals
    // =====================================================================

    private DaemonResponse send(DaemonRequest request) throws DaemonException {
        try (DaemonChannel channel = connector.connectWithRetry()) {
            return executor.execute(channel, request);
        } catch (IOException e) {
            throw new DaemonTransportException("Failed to close channel " + connector.describe(), e);
        }
    }

    private boolean sendIfRunning(DaemonRequest request) throws DaemonException {
        DaemonChannel channel;
        try {
            channel = connector.connectOnce();
        } catch (IOException e) {
            LOG.debug("No daemon on {}, skipping {}", connector.describe(), request.getClass().getSimpleName());
            return false;
        }
        try (channel) {
            executor.execute(channel, request);
            return true;
        } catch (IOException e) {
            throw new DaemonTransportException("Failed to close channel " + connector.describe(), e);
        }
    }

    private static boolean allAddColumn(List<Statement> statements) {
        return statements.stream().allMatch(s -> ADD_COLUMN.matcher(s.sql()).matches());
    }

    private void pause(long millis) throws DaemonUnavailableException {
        if (millis <= 0)
            return;
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DaemonUnavailableException("Interrupted during file operation settle delay", e);
        }
    }
}
