package de.bsommerfeld.gridkeeper.db.migration;

import com.google.inject.Singleton;
import de.bsommerfeld.gridkeeper.client.DaemonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs an ordered list of fixes against one database.
 *
 * <p>
 * The manager keeps no registry; callers pass the list they want applied
 * (usually {@link de.bsommerfeld.gridkeeper.db.migration.fixes.MigrationFixes#standard()}).
 * Fixes run in list order. The first failure stops the run.
 */
@Singleton
public class MigrationFixManager {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationFixManager.class);

    /**
     * Applies every pending fix.
     *
     * @return ids of the fixes applied by this run, in order; empty when
     *         everything was already applied
     * @throws MigrationException for the first fix that failed
     */
    public List<String> applyAll(List<MigrationFix> fixes, MigrationContext context) throws MigrationException {
        List<String> applied = new ArrayList<>();
        for (MigrationFix fix : fixes) {
            if (applyIfPending(fix, context))
                applied.add(fix.id());
        }
        if (applied.isEmpty()) {
            LOG.debug("No pending migration fixes for {}", context.database());
        } else {
            LOG.info("Applied {} migration fix(es) to {}: {}", applied.size(), context.database(), applied);
        }
        return applied;
    }

    /**
     * Applies a single fix from {@code fixes}.
     *
     * @return {@code false} if it was already applied
     * @throws IllegalArgumentException if no fix has that id
     */
    public boolean applyFixById(List<MigrationFix> fixes, String fixId, MigrationContext context)
            throws MigrationException {
        MigrationFix fix = fixes.stream()
                .filter(f -> f.id().equals(fixId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown migration fix: " + fixId));
        return applyIfPending(fix, context);
    }

    public List<FixStatus> listFixes(List<MigrationFix> fixes, MigrationContext context) throws MigrationException {
        List<FixStatus> statuses = new ArrayList<>();
        for (MigrationFix fix : fixes) {
            try {
                statuses.add(new FixStatus(fix.id(), fix.description(), fix.isApplied(context)));
            } catch (SQLException e) {
                throw new MigrationException(fix.id(), "Could not read state of " + fix.id(), e);
            }
        }
        return statuses;
    }

    private boolean applyIfPending(MigrationFix fix, MigrationContext context) throws MigrationException {
        try {
            if (fix.isApplied(context)) {
                LOG.debug("Migration fix {} already applied to {}", fix.id(), context.database());
                return false;
            }
            LOG.info("Applying migration fix {} to {}: {}", fix.id(), context.database(), fix.description());
            fix.apply(context);
            fix.markApplied(context);
            return true;
        } catch (SQLException | DaemonException e) {
            throw new MigrationException(fix.id(),
                    "Migration fix " + fix.id() + " failed on " + context.database() + ": " + e.getMessage(), e);
        }
    }
}
