package de.bsommerfeld.gridkeeper.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Request sent from a client to the daemon. The concrete variant is written
 * to the wire as the {@code type} property, e.g.
 * {@code {"type":"ExecBatch","db":"galaxy.db","stmts":[...],"tx":"atomic"}}.
 *
 * <p>
 * The variant set is closed: every implementation is listed in
 * {@link JsonSubTypes} below and handled by the daemon's request handler.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DaemonRequest.ExecBatch.class, name = "ExecBatch"),
        @JsonSubTypes.Type(value = DaemonRequest.PrepareForMaintenance.class, name = "PrepareForMaintenance"),
        @JsonSubTypes.Type(value = DaemonRequest.CloseDatabase.class, name = "CloseDatabase"),
        @JsonSubTypes.Type(value = DaemonRequest.ReopenDatabase.class, name = "ReopenDatabase"),
        @JsonSubTypes.Type(value = DaemonRequest.Ping.class, name = "Ping"),
        @JsonSubTypes.Type(value = DaemonRequest.Shutdown.class, name = "Shutdown"),
        @JsonSubTypes.Type(value = DaemonRequest.Disconnect.class, name = "Disconnect")
})
public interface DaemonRequest {

    /**
     * Executes {@code stmts} against {@code db} as one unit.
     */
    record ExecBatch(
            @JsonProperty("db") String db,
            @JsonProperty("stmts") List<Statement> stmts,
            @JsonProperty("tx") TransactionMode tx) implements DaemonRequest {

        public ExecBatch {
            stmts = stmts == null ? List.of() : List.copyOf(stmts);
            if (tx == null)
                tx = TransactionMode.ATOMIC;
        }

        public static ExecBatch atomic(String db, List<Statement> stmts) {
            return new ExecBatch(db, stmts, TransactionMode.ATOMIC);
        }
    }

    /** Checkpoints the daemon's write-ahead log for {@code db}. */
    record PrepareForMaintenance(@JsonProperty("db") String db) implements DaemonRequest {
    }

    /** Releases the daemon's handle on {@code db}. */
    record CloseDatabase(@JsonProperty("db") String db) implements DaemonRequest {
    }

    /** Re-acquires a handle on {@code db}, possibly under a new file name. */
    record ReopenDatabase(@JsonProperty("db") String db) implements DaemonRequest {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Ping(@JsonProperty("db") String db) implements DaemonRequest {
    }

    /** Stops the daemon for every client. */
    record Shutdown() implements DaemonRequest {
    }

    /** Ends the calling client's session only. */
    record Disconnect() implements DaemonRequest {
    }
}
