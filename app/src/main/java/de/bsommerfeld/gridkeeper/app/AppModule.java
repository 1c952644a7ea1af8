package de.bsommerfeld.gridkeeper.app;

import com.google.inject.AbstractModule;
import de.bsommerfeld.gridkeeper.core.config.ConfigLoader;
import de.bsommerfeld.gridkeeper.core.config.GridkeeperConfig;
import de.bsommerfeld.gridkeeper.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Guice module for the storage application. Everything else binds itself
 * just-in-time through {@code @Singleton} / {@code @Inject}.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path appDataDir;

    public AppModule() {
        this(StorageUtils.getAppDataDir(GridkeeperConfig.APP_NAME));
    }

    public AppModule(Path appDataDir) {
        this.appDataDir = appDataDir;
    }

    @Override
    protected void configure() {
        try {
            if (!Files.exists(appDataDir)) {
                Files.createDirectories(appDataDir);
            }
            Path configPath = appDataDir.resolve("config.toml");
            LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());

            GridkeeperConfig config = ConfigLoader.load(configPath);
            bind(GridkeeperConfig.class).toInstance(config);
        } catch (Exception e) {
            // config is vital, fail fast
            throw new RuntimeException("Failed to load Application Configuration", e);
        }
    }
}
