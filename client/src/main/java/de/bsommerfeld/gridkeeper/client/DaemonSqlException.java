package de.bsommerfeld.gridkeeper.client;

/**
 * The daemon executed the request and reported an error. The message is the
 * daemon's text, verbatim.
 */
public class DaemonSqlException extends DaemonException {

    private final String code;
    private final ErrorClass errorClass;

    public DaemonSqlException(String message, String code, ErrorClass errorClass) {
        super(message);
        this.code = code;
        this.errorClass = errorClass;
    }

    /** Engine result-code name, e.g. {@code SQLITE_CONSTRAINT_UNIQUE}; may be {@code null}. */
    public String getCode() {
        return code;
    }

    public ErrorClass getErrorClass() {
        return errorClass;
    }
}
