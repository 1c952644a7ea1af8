package de.bsommerfeld.gridkeeper.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.gridkeeper.core.config.GridkeeperConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void injector_shouldWriteDefaultConfigAndWireBootstrap() {
        Path appData = tempDir.resolve("gridkeeper");

        Injector injector = Guice.createInjector(new AppModule(appData));

        assertTrue(Files.exists(appData.resolve("config.toml")));
        assertSame(injector.getInstance(GridkeeperConfig.class), injector.getInstance(GridkeeperConfig.class));
        assertNotNull(injector.getInstance(StorageBootstrap.class));
        assertSame(injector.getInstance(MigrationRunner.class), injector.getInstance(MigrationRunner.class));
    }
}
