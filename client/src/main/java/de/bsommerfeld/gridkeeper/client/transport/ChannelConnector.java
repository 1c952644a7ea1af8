package de.bsommerfeld.gridkeeper.client.transport;

import java.io.IOException;

/**
 * Opens a single connection to the daemon channel, without retrying.
 */
public interface ChannelConnector {

    DaemonChannel open() throws IOException;

    /** Human-readable address for log and error messages. */
    String describe();
}
