package de.bsommerfeld.gridkeeper.client;

/**
 * Base type of every failure reported by {@link DaemonClient}.
 */
public class DaemonException extends Exception {

    public DaemonException(String message) {
        super(message);
    }

    public DaemonException(String message, Throwable cause) {
        super(message, cause);
    }
}
