package de.bsommerfeld.gridkeeper.db.checkpoint;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.gridkeeper.core.config.GridkeeperConfig;
import de.bsommerfeld.gridkeeper.core.event.ApplicationEventBus;
import de.bsommerfeld.gridkeeper.core.event.StorageEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link CheckpointManager#checkpointAll()} on a fixed interval,
 * independent of write volume, and once more on {@link #shutdown()}. Each
 * pass is reported as a {@link StorageEvents.CheckpointCompletedEvent}.
 */
@Singleton
public class CheckpointScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointScheduler.class);

    private final CheckpointManager manager;
    private final ApplicationEventBus eventBus;
    private final long intervalSeconds;

    private ScheduledExecutorService scheduler;

    @Inject
    public CheckpointScheduler(CheckpointManager manager, ApplicationEventBus eventBus, GridkeeperConfig config) {
        this(manager, eventBus, config.getStorage().getCheckpointIntervalSeconds());
    }

    public CheckpointScheduler(CheckpointManager manager, ApplicationEventBus eventBus, long intervalSeconds) {
        this.manager = manager;
        this.eventBus = eventBus;
        this.intervalSeconds = Math.max(1, intervalSeconds);
    }

    public synchronized void start() {
        if (scheduler != null)
            return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "checkpoint-timer");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::runPass, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        LOG.info("Periodic checkpoint every {}s", intervalSeconds);
    }

    /**
     * Stops the timer, waits for a running pass and then checkpoints every
     * database one final time. Must complete before the process exits.
     */
    public synchronized CheckpointSummary shutdown() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(10, TimeUnit.SECONDS))
                    scheduler.shutdownNow();
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
        LOG.info("Final checkpoint before exit");
        return runPass();
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    CheckpointSummary runPass() {
        CheckpointSummary summary = manager.checkpointAll();
        eventBus.post(new StorageEvents.CheckpointCompletedEvent(
                summary.checkpointed(), summary.skipped(), summary.failed()));
        return summary;
    }
}
