package de.bsommerfeld.gridkeeper.client;

/**
 * The daemon could not be reached and auto-start did not help: the executable
 * is missing, the spawn failed, or the retry budget ran out.
 *
 * <p>
 * {@link #getMessage()} keeps the technical detail for the log;
 * {@link #getUserMessage()} is what a user should see.
 */
public class DaemonUnavailableException extends DaemonException {

    public static final String USER_MESSAGE = "could not reach or start the background service";

    public DaemonUnavailableException(String message) {
        super(message);
    }

    public DaemonUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getUserMessage() {
        return USER_MESSAGE;
    }
}
