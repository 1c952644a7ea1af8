package de.bsommerfeld.gridkeeper.client;

/**
 * Outcome of {@link DaemonClient#execBatch}.
 *
 * @param outcome      what happened
 * @param rowsAffected sum of update counts; 0 unless {@link Outcome#APPLIED}
 * @param detail       daemon text behind a non-applied outcome, else {@code null}
 */
public record BatchResult(Outcome outcome, long rowsAffected, String detail) {

    public enum Outcome {
        /** Committed. */
        APPLIED,
        /** Idempotent column add whose column already exists. */
        ALREADY_APPLIED,
        /** A per-table metadata table is not visible yet; try again later. */
        DEFERRED
    }

    public static BatchResult applied(long rowsAffected) {
        return new BatchResult(Outcome.APPLIED, rowsAffected, null);
    }

    public static BatchResult alreadyApplied(String detail) {
        return new BatchResult(Outcome.ALREADY_APPLIED, 0, detail);
    }

    public static BatchResult deferred(String detail) {
        return new BatchResult(Outcome.DEFERRED, 0, detail);
    }

    /** True for every outcome that leaves the database in the requested state. */
    public boolean isSuccess() {
        return outcome != Outcome.DEFERRED;
    }
}
