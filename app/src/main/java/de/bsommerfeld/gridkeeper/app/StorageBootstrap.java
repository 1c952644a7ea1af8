package de.bsommerfeld.gridkeeper.app;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.gridkeeper.client.DaemonClient;
import de.bsommerfeld.gridkeeper.client.DaemonException;
import de.bsommerfeld.gridkeeper.client.DaemonUnavailableException;
import de.bsommerfeld.gridkeeper.core.config.GridkeeperConfig;
import de.bsommerfeld.gridkeeper.core.event.ApplicationEventBus;
import de.bsommerfeld.gridkeeper.core.event.StorageEvents;
import de.bsommerfeld.gridkeeper.db.checkpoint.CheckpointScheduler;
import de.bsommerfeld.gridkeeper.db.checkpoint.CheckpointSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Startup and shutdown order of the storage subsystem.
 *
 * <pre>
 * start: data directory -> daemon ping (auto-start) -> migrations -> checkpoint timer
 * stop:  checkpoint timer + final checkpoint -> disconnect
 * </pre>
 */
@Singleton
public class StorageBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(StorageBootstrap.class);

    private final GridkeeperConfig config;
    private final DaemonClient daemon;
    private final MigrationRunner migrations;
    private final CheckpointScheduler checkpoints;
    private final ApplicationEventBus eventBus;

    @Inject
    public StorageBootstrap(GridkeeperConfig config, DaemonClient daemon, MigrationRunner migrations,
            CheckpointScheduler checkpoints, ApplicationEventBus eventBus) {
        this.config = config;
        this.daemon = daemon;
        this.migrations = migrations;
        this.checkpoints = checkpoints;
        this.eventBus = eventBus;
    }

    /**
     * @return {@code true} if the daemon answered; without it migrations are
     *         skipped but checkpoints still run locally
     */
    public boolean start() throws IOException {
        Path dataDir = config.resolveDataDirectory();
        Files.createDirectories(dataDir);
        LOG.info("Managing databases in {}", dataDir);

        boolean daemonUp = daemon.ping(null);
        if (daemonUp) {
            migrations.runAll();
        } else {
            LOG.error("Daemon on {} unreachable, skipping migrations", daemon.channel());
            eventBus.post(new StorageEvents.DaemonUnavailableEvent(DaemonUnavailableException.USER_MESSAGE));
        }

        checkpoints.start();
        return daemonUp;
    }

    public void stop() {
        CheckpointSummary summary = checkpoints.shutdown();
        if (summary.hasFailures())
            LOG.warn("Final checkpoint failed for {}", summary.failed());

        try {
            daemon.disconnect();
        } catch (DaemonException e) {
            LOG.warn("Disconnect from daemon failed: {}", e.getMessage());
        }
        LOG.info("Storage shut down");
    }
}
