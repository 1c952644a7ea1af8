package de.bsommerfeld.gridkeeper.client;

import java.io.IOException;

/**
 * Filesystem work run by {@link DaemonClient#withSafeFileOperation} while the
 * daemon's handle on the database is released.
 */
@FunctionalInterface
public interface FileOperation {

    void run() throws IOException;
}
