package de.bsommerfeld.gridkeeper.daemon;

import de.bsommerfeld.gridkeeper.core.config.DaemonConfig;
import de.bsommerfeld.gridkeeper.core.config.GridkeeperConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Daemon entry point: {@code gridkeeper-daemon <data-directory>}.
 *
 * <p>
 * The socket path comes from {@value DaemonConfig#SOCKET_ENV}, as set by the
 * client that spawned this process; without it the default location from the
 * configuration defaults is used.
 */
public final class DaemonMain {

    private static final Logger LOG = LoggerFactory.getLogger(DaemonMain.class);

    private DaemonMain() {
    }

    public static void main(String[] args) {
        if (args.length != 1) {
            LOG.error("Usage: gridkeeper-daemon <data-directory>");
            System.exit(2);
        }

        Path dataDirectory = Paths.get(args[0]).toAbsolutePath();
        if (!Files.isDirectory(dataDirectory)) {
            LOG.error("Data directory {} does not exist", dataDirectory);
            System.exit(2);
        }

        GridkeeperConfig defaults = new GridkeeperConfig();
        Path socket = resolveSocket(defaults);
        DaemonServer server = new DaemonServer(dataDirectory, socket, defaults.getDaemon().getMaxFrameBytes());

        try {
            server.start();
        } catch (DaemonAlreadyRunningException e) {
            LOG.info("{}; exiting", e.getMessage());
            return;
        } catch (IOException e) {
            LOG.error("Failed to bind {}", socket, e);
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "daemon-shutdown-hook"));
        LOG.info("Serving databases in {}", dataDirectory);

        try {
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
        }
        LOG.info("Daemon stopped");
    }

    static Path resolveSocket(GridkeeperConfig defaults) {
        String fromEnv = System.getenv(DaemonConfig.SOCKET_ENV);
        if (fromEnv != null && !fromEnv.isBlank())
            return Paths.get(fromEnv).toAbsolutePath();
        return defaults.resolveSocketPath();
    }
}
