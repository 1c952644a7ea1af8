package de.bsommerfeld.gridkeeper.client.transport;

import de.bsommerfeld.gridkeeper.client.DaemonUnavailableException;
import de.bsommerfeld.gridkeeper.core.config.DaemonConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Spawns the daemon in a detached background process. Returns as soon as the
 * process is started; nothing keeps a handle on it, the retry loop in
 * {@link DaemonConnector} finds out whether it came up.
 *
 * <p>
 * The daemon gets exactly one argument, the absolute data directory. Its
 * socket location travels in the {@value DaemonConfig#SOCKET_ENV}
 * environment variable, and its stdout/stderr are appended to
 * {@code <data-dir>/logs/daemon.log}.
 *
 * <p>
 * A {@code .jar} executable is started with the current {@code java}
 * ({@code JAVA_HOME} preferred, else {@code PATH}); any other file is
 * executed directly.
 */
public class DaemonLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(DaemonLauncher.class);

    private final Path executable;
    private final Path dataDirectory;
    private final Path socketPath;

    public DaemonLauncher(Path executable, Path dataDirectory, Path socketPath) {
        this.executable = executable.toAbsolutePath();
        this.dataDirectory = dataDirectory.toAbsolutePath();
        this.socketPath = socketPath.toAbsolutePath();
    }

    /**
     * @throws DaemonUnavailableException if the executable does not exist or
     *                                    the process cannot be started
     */
    public void launch() throws DaemonUnavailableException {
        if (!Files.exists(executable))
            throw new DaemonUnavailableException("Daemon executable not found at " + executable);

        Path logFile = dataDirectory.resolve("logs").resolve("daemon.log");
        try {
            Files.createDirectories(logFile.getParent());

            ProcessBuilder pb = new ProcessBuilder(buildCommand());
            pb.directory(dataDirectory.toFile());
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            pb.redirectError(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            pb.environment().put(DaemonConfig.SOCKET_ENV, socketPath.toString());

            pb.start();
            LOG.info("Started daemon {} for {}", executable.getFileName(), dataDirectory);
        } catch (IOException e) {
            throw new DaemonUnavailableException("Failed to start daemon " + executable + ": " + e.getMessage(), e);
        }
    }

    List<String> buildCommand() {
        List<String> cmd = new ArrayList<>();
        if (executable.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".jar")) {
            cmd.add(resolveJava());
            cmd.add("-jar");
        }
        cmd.add(executable.toString());
        cmd.add(dataDirectory.toString());
        return cmd;
    }

    public Path getExecutable() {
        return executable;
    }

    /**
     * Finds the {@code java} executable. Prefers {@code JAVA_HOME} if set
     * and the binary is executable, otherwise falls back to {@code PATH}.
     */
    private String resolveJava() {
        String javaHome = System.getenv("JAVA_HOME");
        if (javaHome != null) {
            Path java = Path.of(javaHome, "bin", "java");
            if (Files.isExecutable(java))
                return java.toString();
        }
        return "java";
    }
}
