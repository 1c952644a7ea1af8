package de.bsommerfeld.gridkeeper.app;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.gridkeeper.client.DaemonClient;
import de.bsommerfeld.gridkeeper.core.config.GridkeeperConfig;
import de.bsommerfeld.gridkeeper.core.event.ApplicationEventBus;
import de.bsommerfeld.gridkeeper.core.event.StorageEvents;
import de.bsommerfeld.gridkeeper.core.util.StorageUtils;
import de.bsommerfeld.gridkeeper.db.DatabaseReader;
import de.bsommerfeld.gridkeeper.db.migration.MigrationContext;
import de.bsommerfeld.gridkeeper.db.migration.MigrationException;
import de.bsommerfeld.gridkeeper.db.migration.MigrationFix;
import de.bsommerfeld.gridkeeper.db.migration.MigrationFixManager;
import de.bsommerfeld.gridkeeper.db.migration.fixes.MigrationFixes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the standard fixes to every managed database at startup.
 *
 * <p>
 * Migrations harden existing data; they never gate startup. An aborted run is
 * logged loudly, reported as {@link StorageEvents.MigrationFailedEvent} and
 * the next database is migrated regardless.
 */
@Singleton
public class MigrationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationRunner.class);

    private final GridkeeperConfig config;
    private final DaemonClient daemon;
    private final DatabaseReader reader;
    private final MigrationFixManager manager;
    private final ApplicationEventBus eventBus;
    private final List<MigrationFix> fixes;

    @Inject
    public MigrationRunner(GridkeeperConfig config, DaemonClient daemon, DatabaseReader reader,
            MigrationFixManager manager, ApplicationEventBus eventBus) {
        this(config, daemon, reader, manager, eventBus, MigrationFixes.standard());
    }

    MigrationRunner(GridkeeperConfig config, DaemonClient daemon, DatabaseReader reader,
            MigrationFixManager manager, ApplicationEventBus eventBus, List<MigrationFix> fixes) {
        this.config = config;
        this.daemon = daemon;
        this.reader = reader;
        this.manager = manager;
        this.eventBus = eventBus;
        this.fixes = fixes;
    }

    /**
     * @return applied fix ids per database that migrated without error
     */
    public Map<String, List<String>> runAll() {
        Map<String, List<String>> results = new LinkedHashMap<>();
        if (!config.getMigration().isEnabled()) {
            LOG.info("Migrations disabled by configuration");
            return results;
        }

        List<Path> databases;
        try {
            databases = StorageUtils.listDatabaseFiles(reader.getDataDirectory());
        } catch (IOException e) {
            LOG.error("Failed to scan {} for databases, skipping migrations", reader.getDataDirectory(), e);
            return results;
        }

        for (Path file : databases) {
            String database = file.getFileName().toString();
            MigrationContext context = new MigrationContext(database, daemon, reader);
            try {
                List<String> applied = manager.applyAll(fixes, context);
                results.put(database, applied);
                eventBus.post(new StorageEvents.MigrationFinishedEvent(database, applied));
            } catch (MigrationException e) {
                LOG.error("Migration of {} aborted at fix {}", database, e.getFixId(), e);
                eventBus.post(new StorageEvents.MigrationFailedEvent(database, e.getFixId(), e.getMessage()));
            }
        }
        return results;
    }
}
