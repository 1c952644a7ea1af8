package de.bsommerfeld.gridkeeper.client.transport;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;

/**
 * Connects to the daemon over a Unix domain socket whose file name carries the
 * channel name ({@code <namespace>-v1.sock}).
 */
public class UnixSocketConnector implements ChannelConnector {

    private final Path socketPath;

    public UnixSocketConnector(Path socketPath) {
        this.socketPath = socketPath;
    }

    @Override
    public DaemonChannel open() throws IOException {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.connect(UnixDomainSocketAddress.of(socketPath));
            return DaemonChannel.of(channel);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    @Override
    public String describe() {
        return socketPath.toString();
    }

    public Path getSocketPath() {
        return socketPath;
    }
}
