package de.bsommerfeld.gridkeeper.protocol;

import java.io.IOException;

/**
 * Thrown when a frame or message body violates the wire format: truncated or
 * oversized frames, undecodable JSON, unknown status values. Never retried.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
