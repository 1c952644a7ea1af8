package de.bsommerfeld.gridkeeper.client;

/**
 * Classification of an error reported by the daemon.
 */
public enum ErrorClass {

    /**
     * "no such table" on a per-table {@code _Metadata} table. Happens at
     * startup while a freshly created table is not yet visible; retryable.
     */
    MISSING_METADATA_TABLE,

    /** "duplicate column name" from an ALTER TABLE ... ADD COLUMN that already ran. */
    DUPLICATE_COLUMN,

    /** Everything else. */
    FATAL;

    public boolean isBenign() {
        return this != FATAL;
    }
}
