package de.bsommerfeld.gridkeeper.core.event;

import java.util.List;

/**
 * Events emitted by the storage subsystem. Payloads are immutable so they can
 * cross thread boundaries safely.
 */
public class StorageEvents {

    /**
     * Result of one checkpoint pass over the managed directory.
     */
    public record CheckpointCompletedEvent(List<String> checkpointed, List<String> skipped, List<String> failed) {
        public CheckpointCompletedEvent {
            checkpointed = List.copyOf(checkpointed);
            skipped = List.copyOf(skipped);
            failed = List.copyOf(failed);
        }
    }

    public record MigrationFinishedEvent(String database, List<String> appliedFixes) {
        public MigrationFinishedEvent {
            appliedFixes = List.copyOf(appliedFixes);
        }
    }

    public record MigrationFailedEvent(String database, String fixId, String message) {
    }

    /**
     * The daemon could neither be reached nor started. {@code message} is the
     * user-facing text; details are in the log.
     */
    public record DaemonUnavailableEvent(String message) {
    }
}
