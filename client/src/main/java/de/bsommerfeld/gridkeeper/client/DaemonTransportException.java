package de.bsommerfeld.gridkeeper.client;

/**
 * I/O failure after the channel was opened: short write, broken pipe, or the
 * daemon hanging up before it answered.
 */
public class DaemonTransportException extends DaemonException {

    public DaemonTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
