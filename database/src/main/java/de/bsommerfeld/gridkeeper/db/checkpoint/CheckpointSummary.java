package de.bsommerfeld.gridkeeper.db.checkpoint;

import java.util.List;

/**
 * File names per outcome of one {@link CheckpointManager#checkpointAll()} pass.
 */
public record CheckpointSummary(List<String> checkpointed, List<String> skipped, List<String> failed) {

    public CheckpointSummary {
        checkpointed = List.copyOf(checkpointed);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
