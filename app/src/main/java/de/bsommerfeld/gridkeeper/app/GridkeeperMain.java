package de.bsommerfeld.gridkeeper.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.gridkeeper.core.config.GridkeeperConfig;
import de.bsommerfeld.gridkeeper.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Application entry point. Runs the storage subsystem until the JVM is asked
 * to exit.
 */
public final class GridkeeperMain {

    static {
        // read by logback.xml; must be set before the first logger exists
        System.setProperty("gridkeeper.log.dir",
                StorageUtils.getLogsDir(GridkeeperConfig.APP_NAME).toString());
    }

    private static final Logger LOG = LoggerFactory.getLogger(GridkeeperMain.class);

    private GridkeeperMain() {
    }

    public static void main(String[] args) throws Exception {
        Injector injector = Guice.createInjector(new AppModule());
        StorageBootstrap bootstrap = injector.getInstance(StorageBootstrap.class);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                bootstrap.stop();
            } finally {
                stopped.countDown();
            }
        }, "gridkeeper-shutdown-hook"));

        bootstrap.start();
        LOG.info("Gridkeeper started");
        stopped.await();
    }
}
