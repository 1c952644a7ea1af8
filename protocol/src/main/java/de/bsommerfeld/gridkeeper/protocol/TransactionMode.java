package de.bsommerfeld.gridkeeper.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How the daemon groups the statements of one batch.
 */
public enum TransactionMode {

    /** All statements commit together or none do. */
    @JsonProperty("atomic")
    ATOMIC
}
