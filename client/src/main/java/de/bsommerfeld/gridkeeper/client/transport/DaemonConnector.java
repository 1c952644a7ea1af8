package de.bsommerfeld.gridkeeper.client.transport;

import de.bsommerfeld.gridkeeper.client.DaemonUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Connect-with-retry and one-shot auto-start.
 *
 * <p>
 * The first failed attempt is taken to mean "daemon not running": the
 * daemon is spawned once and the connector waits the settle delay. Every later
 * failure waits {@code base * (attempt + 1)}. When the budget is spent the
 * call fails; there is no second spawn.
 */
public class DaemonConnector {

    private static final Logger LOG = LoggerFactory.getLogger(DaemonConnector.class);

    private final ChannelConnector connector;
    private final DaemonLauncher launcher;
    private final int maxRetries;
    private final long startupSettleMillis;
    private final long retryBaseDelayMillis;
    private final Sleeper sleeper;

    public DaemonConnector(ChannelConnector connector, DaemonLauncher launcher, int maxRetries,
            long startupSettleMillis, long retryBaseDelayMillis, Sleeper sleeper) {
        this.connector = connector;
        this.launcher = launcher;
        this.maxRetries = Math.max(1, maxRetries);
        this.startupSettleMillis = startupSettleMillis;
        this.retryBaseDelayMillis = retryBaseDelayMillis;
        this.sleeper = sleeper;
    }

    /**
     * Opens a channel, starting the daemon if nobody answers.
     *
     * @throws DaemonUnavailableException if the executable is missing, the
     *                                    spawn fails, or every attempt failed
     */
    public DaemonChannel connectWithRetry() throws DaemonUnavailableException {
        IOException lastFailure = null;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                return connector.open();
            } catch (IOException e) {
                lastFailure = e;
                LOG.debug("Connect attempt {}/{} to {} failed: {}",
                        attempt + 1, maxRetries, connector.describe(), e.getMessage());
            }

            if (attempt == 0) {
                launcher.launch();
                pause(startupSettleMillis);
            } else if (attempt < maxRetries - 1) {
                pause(retryBaseDelayMillis * (attempt + 1));
            }
        }

        throw new DaemonUnavailableException("No daemon answered on " + connector.describe()
                + " after " + maxRetries + " attempts", lastFailure);
    }

    /**
     * Single attempt, no auto-start. For operations that are pointless
     * against a daemon that is not running.
     */
    public DaemonChannel connectOnce() throws IOException {
        return connector.open();
    }

    public String describe() {
        return connector.describe();
    }

    private void pause(long millis) throws DaemonUnavailableException {
        if (millis <= 0)
            return;
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DaemonUnavailableException("Interrupted while waiting for the daemon", e);
        }
    }
}
