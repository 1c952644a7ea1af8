package de.bsommerfeld.gridkeeper.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response from the daemon.
 *
 * <p>
 * {@code rev} is a request counter that grows with every request the daemon
 * serves. It says nothing about protocol compatibility, which is fixed by the
 * channel name at connection time.
 *
 * <p>
 * Error text may arrive in either {@code error} or {@code message};
 * {@link #errorText()} checks both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DaemonResponse(
        @JsonProperty("status") String status,
        @JsonProperty("rev") Long rev,
        @JsonProperty("rows_affected") Long rowsAffected,
        @JsonProperty("error") String error,
        @JsonProperty("message") String message,
        @JsonProperty("code") String code,
        @JsonProperty("checkpointed") Boolean checkpointed,
        @JsonProperty("closed") Boolean closed,
        @JsonProperty("reopened") Boolean reopened) {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    public static DaemonResponse ok(long rev) {
        return new DaemonResponse(STATUS_OK, rev, null, null, null, null, null, null, null);
    }

    public static DaemonResponse applied(long rev, long rows) {
        return new DaemonResponse(STATUS_OK, rev, rows, null, null, null, null, null, null);
    }

    public static DaemonResponse error(long rev, String message, String code) {
        return new DaemonResponse(STATUS_ERROR, rev, null, null, message, code, null, null, null);
    }

    public DaemonResponse withCheckpointed(boolean value) {
        return new DaemonResponse(status, rev, rowsAffected, error, message, code, value, closed, reopened);
    }

    public DaemonResponse withClosed(boolean value) {
        return new DaemonResponse(status, rev, rowsAffected, error, message, code, checkpointed, value, reopened);
    }

    public DaemonResponse withReopened(boolean value) {
        return new DaemonResponse(status, rev, rowsAffected, error, message, code, checkpointed, closed, value);
    }

    @JsonIgnore
    public boolean isOk() {
        return STATUS_OK.equals(status);
    }

    @JsonIgnore
    public boolean isError() {
        return STATUS_ERROR.equals(status);
    }

    @JsonIgnore
    public String errorText() {
        if (error != null && !error.isBlank())
            return error;
        if (message != null && !message.isBlank())
            return message;
        return "Unknown error";
    }

    @JsonIgnore
    public long rowsAffectedOrZero() {
        return rowsAffected == null ? 0 : rowsAffected;
    }
}
