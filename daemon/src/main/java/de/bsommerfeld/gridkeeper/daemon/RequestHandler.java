package de.bsommerfeld.gridkeeper.daemon;

import de.bsommerfeld.gridkeeper.protocol.DaemonRequest;
import de.bsommerfeld.gridkeeper.protocol.DaemonResponse;
import de.bsommerfeld.gridkeeper.protocol.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns one request into one response. Runs on the writer thread only, so
 * requests are applied strictly one after another.
 */
class RequestHandler {

    private static final Logger LOG = LoggerFactory.getLogger(RequestHandler.class);

    private final DatabaseRegistry registry;
    private final AtomicLong rev = new AtomicLong();

    RequestHandler(DatabaseRegistry registry) {
        this.registry = registry;
    }

    DaemonResponse handle(DaemonRequest request) {
        long current = rev.incrementAndGet();
        try {
            if (request instanceof DaemonRequest.ExecBatch batch)
                return DaemonResponse.applied(current, execBatch(batch.db(), batch.stmts()));
            if (request instanceof DaemonRequest.PrepareForMaintenance prepare)
                return DaemonResponse.ok(current).withCheckpointed(registry.checkpoint(prepare.db()));
            if (request instanceof DaemonRequest.CloseDatabase close) {
                registry.close(close.db());
                return DaemonResponse.ok(current).withClosed(true);
            }
            if (request instanceof DaemonRequest.ReopenDatabase reopen) {
                registry.reopen(reopen.db());
                return DaemonResponse.ok(current).withReopened(true);
            }
            // Ping, Shutdown and Disconnect need no database work here
            return DaemonResponse.ok(current);
        } catch (SQLException e) {
            LOG.warn("{} failed: {}", request.getClass().getSimpleName(), e.getMessage());
            return DaemonResponse.error(current, e.getMessage(), resultCode(e));
        } catch (IllegalArgumentException e) {
            return DaemonResponse.error(current, e.getMessage(), "INVALID_REQUEST");
        }
    }

    /**
     * Runs the batch in one transaction.
     *
     * @return sum of the statements' update counts
     */
    private long execBatch(String db, List<Statement> statements) throws SQLException {
        Connection conn = registry.connection(db);
        conn.setAutoCommit(false);
        try {
            long rows = 0;
            for (Statement stmt : statements) {
                try (PreparedStatement ps = conn.prepareStatement(stmt.sql())) {
                    List<Object> params = stmt.params();
                    for (int i = 0; i < params.size(); i++) {
                        ps.setObject(i + 1, params.get(i));
                    }
                    if (!ps.execute())
                        rows += Math.max(0, ps.getUpdateCount());
                }
            }
            conn.commit();
            LOG.debug("Committed {} statement(s) on {}, {} row(s)", statements.size(), db, rows);
            return rows;
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private static String resultCode(SQLException e) {
        if (e instanceof SQLiteException sqlite && sqlite.getResultCode() != null)
            return sqlite.getResultCode().name();
        return null;
    }
}
