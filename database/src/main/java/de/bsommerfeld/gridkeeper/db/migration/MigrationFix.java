package de.bsommerfeld.gridkeeper.db.migration;

import de.bsommerfeld.gridkeeper.client.DaemonException;

import java.sql.SQLException;

/**
 * One versioned, idempotent repair or upgrade routine.
 *
 * <p>
 * Ids follow {@code <slug>_<yyyy>_<mm>_<dd>} and never change once released.
 * {@link #apply} must detect a state that is already fixed and do nothing,
 * since a fix can have logically happened without being recorded.
 */
public interface MigrationFix {

    String id();

    String description();

    void apply(MigrationContext context) throws SQLException, DaemonException;

    default boolean isApplied(MigrationContext context) throws SQLException {
        return FixTracker.isApplied(context, id());
    }

    default void markApplied(MigrationContext context) throws DaemonException {
        FixTracker.markApplied(context, id(), description());
    }
}
