package de.bsommerfeld.gridkeeper.daemon;

import java.io.IOException;

/**
 * Another daemon already answers on the socket this one wanted to bind.
 */
public class DaemonAlreadyRunningException extends IOException {

    public DaemonAlreadyRunningException(String message) {
        super(message);
    }
}
