package de.bsommerfeld.gridkeeper.client.transport;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;

/**
 * An open duplex byte stream to the daemon. Used for exactly one
 * request/response exchange and then closed.
 */
public class DaemonChannel implements Closeable {

    private final InputStream input;
    private final OutputStream output;
    private final Closeable resource;

    public DaemonChannel(InputStream input, OutputStream output, Closeable resource) {
        this.input = input;
        this.output = output;
        this.resource = resource;
    }

    public static DaemonChannel of(SocketChannel channel) {
        return new DaemonChannel(
                new BufferedInputStream(Channels.newInputStream(channel)),
                new BufferedOutputStream(Channels.newOutputStream(channel)),
                channel);
    }

    public InputStream input() {
        return input;
    }

    public OutputStream output() {
        return output;
    }

    @Override
    public void close() throws IOException {
        resource.close();
    }
}
