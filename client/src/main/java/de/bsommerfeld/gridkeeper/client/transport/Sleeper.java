package de.bsommerfeld.gridkeeper.client.transport;

/**
 * Blocking pause on the calling thread. Replaced in tests to observe delays
 * without waiting for them.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
