package de.bsommerfeld.gridkeeper.db.checkpoint;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.gridkeeper.client.DaemonClient;
import de.bsommerfeld.gridkeeper.client.DaemonException;
import de.bsommerfeld.gridkeeper.core.util.StorageUtils;
import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Forces write-ahead-log content into the main database files.
 *
 * <p>
 * With {@code synchronous=NORMAL} committed data can sit in the
 * {@code -wal} file for a while. A crash or an improper shutdown before the
 * next automatic checkpoint then looks like lost writes to the user. This
 * class runs {@code PRAGMA wal_checkpoint(RESTART)} on demand.
 *
 * <h3>Skipped files</h3>
 * A database without a {@code -wal} sibling, with an empty WAL or with a WAL
 * shorter than its 32-byte header has nothing to checkpoint. A database not
 * in WAL mode is skipped as well.
 *
 * <h3>Route</h3>
 * When a {@link DaemonClient} is available the checkpoint is requested from
 * the daemon, which owns the write handle. If that fails the file is
 * checkpointed through a local connection.
 */
@Singleton
public class CheckpointManager {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointManager.class);

    static final long WAL_HEADER_BYTES = 32;

    private final DatabaseReader reader;
    private final DaemonClient daemon;

    @Inject
    public CheckpointManager(DatabaseReader reader, DaemonClient daemon) {
        this.reader = reader;
        this.daemon = daemon;
    }

    /** Local checkpoints only. */
    public CheckpointManager(DatabaseReader reader) {
        this(reader, null);
    }

    /**
     * Checkpoints one database file.
     *
     * @return {@code true} if a checkpoint ran, {@code false} if the file was
     *         skipped
     * @throws SQLException if the local checkpoint failed
     */
    public boolean checkpointFile(Path database) throws SQLException {
        if (!Files.exists(database))
            return false;
        if (!hasPendingWal(database)) {
            LOG.trace("No pending WAL data for {}", database.getFileName());
            return false;
        }

        if (daemon != null && checkpointThroughDaemon(database))
            return true;
        return checkpointLocally(database);
    }

    /**
     * Checkpoints every {@code *.db} file in the data directory. The directory
     * is rescanned on each call. A failing file is logged and does not stop
     * the others.
     */
    public CheckpointSummary checkpointAll() {
        List<String> checkpointed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        List<Path> files;
        try {
            files = StorageUtils.listDatabaseFiles(reader.getDataDirectory());
        } catch (IOException e) {
            LOG.error("Failed to scan {} for databases: {}", reader.getDataDirectory(), e.getMessage());
            return new CheckpointSummary(checkpointed, skipped, failed);
        }

        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                if (checkpointFile(file)) {
                    checkpointed.add(name);
                    LOG.info("Checkpointed {}", name);
                } else {
                    skipped.add(name);
                }
            } catch (SQLException | RuntimeException e) {
                failed.add(name);
                LOG.error("Checkpoint of {} failed: {}", name, e.getMessage());
            }
        }

        if (!checkpointed.isEmpty() || !failed.isEmpty())
            LOG.info("Checkpoint pass: {} checkpointed, {} skipped, {} failed",
                    checkpointed.size(), skipped.size(), failed.size());
        return new CheckpointSummary(checkpointed, skipped, failed);
    }

    static boolean hasPendingWal(Path database) {
        Path wal = database.resolveSibling(database.getFileName() + "-wal");
        try {
            return Files.exists(wal) && Files.size(wal) >= WAL_HEADER_BYTES;
        } catch (IOException e) {
            // vanished between the two calls
            return false;
        }
    }

    private boolean checkpointThroughDaemon(Path database) {
        String name = database.getFileName().toString();
        try {
            daemon.prepareForMaintenance(name);
            return true;
        } catch (DaemonException e) {
            LOG.debug("Daemon checkpoint of {} failed, falling back to local handle: {}", name, e.getMessage());
            return false;
        }
    }

    private boolean checkpointLocally(Path database) throws SQLException {
        try (Connection conn = reader.getConnection(database); Statement stmt = conn.createStatement()) {
            try (ResultSet rs = stmt.executeQuery("PRAGMA journal_mode")) {
                String mode = rs.next() ? rs.getString(1) : "";
                if (!"wal".equalsIgnoreCase(mode)) {
                    LOG.trace("{} is in {} mode, skipping checkpoint", database.getFileName(), mode);
                    return false;
                }
            }
            try (ResultSet rs = stmt.executeQuery("PRAGMA wal_checkpoint(RESTART)")) {
                if (rs.next() && rs.getInt(1) != 0)
                    LOG.warn("Checkpoint of {} was busy; {} of {} frames written",
                            database.getFileName(), rs.getInt(3), rs.getInt(2));
            }
            return true;
        }
    }
}
