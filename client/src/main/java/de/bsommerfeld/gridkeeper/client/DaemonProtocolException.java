package de.bsommerfeld.gridkeeper.client;

/**
 * The daemon answered with something that is not a valid response.
 */
public class DaemonProtocolException extends DaemonException {

    public DaemonProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
