package de.bsommerfeld.gridkeeper.db.migration;

import de.bsommerfeld.gridkeeper.client.BatchResult;
import de.bsommerfeld.gridkeeper.client.DaemonClient;
import de.bsommerfeld.gridkeeper.client.DaemonException;
import de.bsommerfeld.gridkeeper.client.DaemonSqlException;
import de.bsommerfeld.gridkeeper.client.ErrorClass;
import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.protocol.Statement;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * What a fix gets to work with: the target database, a read-side connection
 * factory and the daemon for every write. Fixes never write through a JDBC
 * connection of their own.
 */
public final class MigrationContext {

    private final String database;
    private final DaemonClient daemon;
    private final DatabaseReader reader;

    public MigrationContext(String database, DaemonClient daemon, DatabaseReader reader) {
        this.database = database;
        this.daemon = daemon;
        this.reader = reader;
    }

    public String database() {
        return database;
    }

    public DaemonClient daemon() {
        return daemon;
    }

    /** Opens a read connection; the caller closes it. */
    public Connection openReadConnection() throws SQLException {
        return reader.getConnection(database);
    }

    /**
     * Sends {@code statements} as one atomic batch. A deferred batch is an
     * error here: a fix must not be recorded as applied if its writes never
     * happened.
     */
    public BatchResult exec(List<Statement> statements) throws DaemonException {
        BatchResult result = daemon.execBatch(statements, database);
        if (!result.isSuccess())
            throw new DaemonSqlException(result.detail(), null, ErrorClass.MISSING_METADATA_TABLE);
        return result;
    }
}
