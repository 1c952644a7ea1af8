package de.bsommerfeld.gridkeeper.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void getAppDataDir_shouldContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getAppDataDir_shouldBeAbsolute() {
        assertTrue(StorageUtils.getAppDataDir("test-app").isAbsolute());
    }

    @Test
    void getLogsDir_shouldBeSubdirOfAppDataDir() {
        Path appDir = StorageUtils.getAppDataDir("test-app");
        Path logsDir = StorageUtils.getLogsDir("test-app");

        assertEquals(appDir.resolve("logs"), logsDir);
    }

    @Test
    void listDatabaseFiles_shouldReturnOnlyDbFilesSorted() throws Exception {
        Files.createFile(tempDir.resolve("b.db"));
        Files.createFile(tempDir.resolve("a.db"));
        Files.createFile(tempDir.resolve("a.db-wal"));
        Files.createFile(tempDir.resolve("notes.txt"));
        Files.createDirectory(tempDir.resolve("folder.db"));

        List<Path> files = StorageUtils.listDatabaseFiles(tempDir);

        assertEquals(List.of(tempDir.resolve("a.db"), tempDir.resolve("b.db")), files);
    }

    @Test
    void listDatabaseFiles_shouldPickUpNewlyCreatedFiles() throws Exception {
        assertTrue(StorageUtils.listDatabaseFiles(tempDir).isEmpty());

        Files.createFile(tempDir.resolve("fresh.db"));

        assertEquals(1, StorageUtils.listDatabaseFiles(tempDir).size());
    }

    @Test
    void listDatabaseFiles_shouldReturnEmptyForMissingDirectory() throws Exception {
        assertTrue(StorageUtils.listDatabaseFiles(tempDir.resolve("missing")).isEmpty());
    }

    @Test
    void isDatabaseFile_shouldIgnoreCase() {
        assertTrue(StorageUtils.isDatabaseFile(Path.of("Galaxy.DB")));
        assertFalse(StorageUtils.isDatabaseFile(Path.of("galaxy.db-shm")));
    }
}
