package de.bsommerfeld.gridkeeper.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Resolves OS-specific application data directories and lists the database
 * files managed inside them. Paths are returned absolute but are
 * <strong>not</strong> created; the caller is responsible for that.
 *
 * <p>
 * Resolution order per platform:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    /** File extension of every managed database. */
    public static final String DATABASE_EXTENSION = ".db";

    private StorageUtils() {
    }

    /**
     * Returns the platform-specific application data directory for the given app
     * name. The directory is not guaranteed to exist.
     *
     * @param appName application identifier used as the directory name
     * @return absolute path to the application's data directory
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        Path path;

        if ((os.contains("mac")) || (os.contains("darwin"))) {
            path = Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        } else if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null) {
                path = Paths.get(appData, appName);
            } else {
                path = Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
            }
        } else {
            String xdgData = System.getenv("XDG_DATA_HOME");
            if (xdgData != null && !xdgData.isEmpty()) {
                path = Paths.get(xdgData, appName);
            } else {
                path = Paths.get(System.getProperty("user.home"), ".local", "share", appName);
            }
        }
        return path.toAbsolutePath();
    }

    /**
     * Returns the log directory inside the application data directory.
     *
     * @param appName application identifier
     * @return absolute path to {@code {appDataDir}/logs}
     */
    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    /**
     * Lists the regular {@code *.db} files directly inside {@code dataDir},
     * sorted by file name. The directory is scanned on every call so newly
     * created databases are always included. A missing directory yields an
     * empty list.
     */
    public static List<Path> listDatabaseFiles(Path dataDir) throws IOException {
        if (!Files.isDirectory(dataDir))
            return List.of();
        try (Stream<Path> entries = Files.list(dataDir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(StorageUtils::isDatabaseFile)
                    .sorted()
                    .toList();
        }
    }

    public static boolean isDatabaseFile(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ENGLISH).endsWith(DATABASE_EXTENSION);
    }
}
