package de.bsommerfeld.gridkeeper.db.migration;

/**
 * A fix failed; the run it belonged to stopped at that fix.
 */
public class MigrationException extends Exception {

    private final String fixId;

    public MigrationException(String fixId, String message, Throwable cause) {
        super(message, cause);
        this.fixId = fixId;
    }

    public String getFixId() {
        return fixId;
    }
}
