package de.bsommerfeld.gridkeeper.client;

/**
 * No target database could be determined for a request.
 */
public class DatabaseResolutionException extends DaemonException {

    public DatabaseResolutionException(String message) {
        super(message);
    }

    public DatabaseResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
