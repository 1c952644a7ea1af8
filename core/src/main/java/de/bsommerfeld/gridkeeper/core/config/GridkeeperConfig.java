package de.bsommerfeld.gridkeeper.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.gridkeeper.core.util.StorageUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Root of {@code config.toml}. Path-valued keys are optional in the file;
 * the {@code resolve*} methods fill in the platform defaults so callers
 * never deal with {@code null}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GridkeeperConfig {

    public static final String APP_NAME = "gridkeeper";

    @JsonProperty("daemon")
    private DaemonConfig daemon = new DaemonConfig();

    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    @JsonProperty("migration")
    private MigrationConfig migration = new MigrationConfig();

    public DaemonConfig getDaemon() {
        return daemon;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public MigrationConfig getMigration() {
        return migration;
    }

    /**
     * Directory holding every managed {@code .db} file. Defaults to
     * {@code <app-data>/data}.
     */
    public Path resolveDataDirectory() {
        String configured = storage.getDataDirectory();
        if (configured != null && !configured.isBlank())
            return Paths.get(configured).toAbsolutePath();
        return StorageUtils.getAppDataDir(APP_NAME).resolve("data");
    }

    /**
     * Socket file of the daemon channel, {@code <socket-directory>/<namespace>-v1.sock}.
     */
    public Path resolveSocketPath() {
        String dir = daemon.getSocketDirectory();
        Path base = (dir != null && !dir.isBlank())
                ? Paths.get(dir)
                : Paths.get(System.getProperty("java.io.tmpdir"));
        return base.resolve(daemon.channelName() + ".sock").toAbsolutePath();
    }

    /**
     * Daemon executable used for auto-start. Defaults to
     * {@code <data-dir>/daemon/gridkeeper-daemon.jar}.
     */
    public Path resolveDaemonExecutable() {
        String exe = daemon.getExecutable();
        if (exe != null && !exe.isBlank())
            return Paths.get(exe).toAbsolutePath();
        return resolveDataDirectory().resolve("daemon").resolve("gridkeeper-daemon.jar");
    }
}
