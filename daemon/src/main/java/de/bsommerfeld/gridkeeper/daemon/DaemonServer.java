package de.bsommerfeld.gridkeeper.daemon;

import de.bsommerfeld.gridkeeper.protocol.DaemonRequest;
import de.bsommerfeld.gridkeeper.protocol.DaemonResponse;
import de.bsommerfeld.gridkeeper.protocol.MessageCodec;
import de.bsommerfeld.gridkeeper.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The single-writer daemon: accepts client sessions on a Unix domain socket
 * and applies their requests one at a time.
 *
 * <h3>Threads</h3>
 * <ul>
 * <li><strong>acceptor</strong> – accepts connections and hands each to the
 * session pool</li>
 * <li><strong>sessions</strong> (cached pool) – one per connection; read a
 * frame, wait for its response, write it back, repeat until EOF or
 * {@code Disconnect}</li>
 * <li><strong>writer</strong> (single thread) – the only thread that touches
 * a database handle</li>
 * </ul>
 * Sessions only decode and encode; every request is submitted to the writer
 * and the session blocks until it is done, so batches from different clients
 * never interleave.
 */
public class DaemonServer {

    private static final Logger LOG = LoggerFactory.getLogger(DaemonServer.class);

    private final Path socketPath;
    private final MessageCodec codec;
    private final DatabaseRegistry registry;
    private final RequestHandler handler;

    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "daemon-writer");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService sessions;
    private final Set<SocketChannel> openSessions = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private ServerSocketChannel server;
    private Thread acceptor;

    public DaemonServer(Path dataDirectory, Path socketPath, int maxFrameBytes) {
        this.socketPath = socketPath.toAbsolutePath();
        this.codec = new MessageCodec(maxFrameBytes);
        this.registry = new DatabaseRegistry(dataDirectory.toAbsolutePath());
        this.handler = new RequestHandler(registry);

        AtomicInteger sessionIds = new AtomicInteger();
        this.sessions = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "daemon-session-" + sessionIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Binds the socket and starts accepting. A leftover socket file nobody
     * answers on is removed first.
     *
     * @throws DaemonAlreadyRunningException if a live daemon owns the socket
     */
    public void start() throws IOException {
        removeStaleSocket();
        Files.createDirectories(socketPath.getParent());

        server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        server.bind(UnixDomainSocketAddress.of(socketPath));
        LOG.info("Daemon listening on {}", socketPath);

        acceptor = new Thread(this::acceptLoop, "daemon-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    /**
     * Stops accepting, checkpoints and closes every database, ends all
     * sessions and removes the socket file. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true))
            return;
        LOG.info("Daemon shutting down");

        try {
            if (server != null)
                server.close();
        } catch (IOException e) {
            LOG.warn("Failed to close server socket: {}", e.getMessage());
        }

        writer.submit(registry::closeAll);
        writer.shutdown();
        try {
            if (!writer.awaitTermination(10, TimeUnit.SECONDS))
                LOG.error("Writer did not finish within 10s; databases may not be checkpointed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        for (SocketChannel session : openSessions) {
            closeQuietly(session);
        }
        sessions.shutdownNow();

        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            LOG.warn("Failed to remove socket file {}: {}", socketPath, e.getMessage());
        }
        terminated.countDown();
    }

    /** Blocks until {@link #stop()} has completed. */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public Path getSocketPath() {
        return socketPath;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    // =====================================================================
    // Accept & Sessions
    // =====================================================================

    private void acceptLoop() {
        while (!stopped.get()) {
            try {
                SocketChannel channel = server.accept();
                openSessions.add(channel);
                sessions.submit(() -> serve(channel));
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                if (stopped.get())
                    break;
                LOG.error("Accept failed: {}", e.getMessage());
            }
        }
        LOG.debug("Acceptor stopped");
    }

    private void serve(SocketChannel channel) {
        try (channel) {
            InputStream in = new BufferedInputStream(Channels.newInputStream(channel));
            OutputStream out = new BufferedOutputStream(Channels.newOutputStream(channel));

            while (!stopped.get()) {
                DaemonRequest request;
                try {
                    request = codec.readRequest(in);
                } catch (EOFException e) {
                    break;
                } catch (ProtocolException e) {
                    LOG.warn("Dropping session after malformed request: {}", e.getMessage());
                    codec.writeResponse(out, DaemonResponse.error(0, e.getMessage(), "PROTOCOL"));
                    break;
                }

                codec.writeResponse(out, dispatch(request));

                if (request instanceof DaemonRequest.Disconnect)
                    break;
                if (request instanceof DaemonRequest.Shutdown) {
                    Thread stopper = new Thread(this::stop, "daemon-stop");
                    stopper.start();
                    break;
                }
            }
        } catch (IOException e) {
            if (!stopped.get())
                LOG.debug("Session ended: {}", e.getMessage());
        } finally {
            openSessions.remove(channel);
        }
    }

    private DaemonResponse dispatch(DaemonRequest request) throws IOException {
        try {
            return writer.submit(() -> handler.handle(request)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for the writer", e);
        } catch (ExecutionException e) {
            LOG.error("Unexpected failure handling {}", request.getClass().getSimpleName(), e.getCause());
            return DaemonResponse.error(0, String.valueOf(e.getCause().getMessage()), "INTERNAL");
        } catch (RejectedExecutionException e) {
            return DaemonResponse.error(0, "Daemon is shutting down", "SHUTDOWN");
        }
    }

    // =====================================================================
    // Socket File
    // =====================================================================

    private void removeStaleSocket() throws IOException {
        if (!Files.exists(socketPath))
            return;
        try (SocketChannel probe = SocketChannel.open(StandardProtocolFamily.UNIX)) {
            probe.connect(UnixDomainSocketAddress.of(socketPath));
            throw new DaemonAlreadyRunningException("A daemon is already listening on " + socketPath);
        } catch (DaemonAlreadyRunningException e) {
            throw e;
        } catch (IOException e) {
            LOG.info("Removing stale socket file {}", socketPath);
            Files.deleteIfExists(socketPath);
        }
    }

    private static void closeQuietly(SocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LOG.debug("Failed to close session channel: {}", e.getMessage());
        }
    }
}
