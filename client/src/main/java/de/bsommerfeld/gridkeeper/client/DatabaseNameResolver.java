package de.bsommerfeld.gridkeeper.client;

import de.bsommerfeld.gridkeeper.core.util.StorageUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Picks the target database of a request: the explicit argument, else the
 * configured name, else the only {@code .db} file in the data directory.
 */
public class DatabaseNameResolver {

    private final Path dataDirectory;
    private final String configuredName;

    public DatabaseNameResolver(Path dataDirectory, String configuredName) {
        this.dataDirectory = dataDirectory;
        this.configuredName = configuredName;
    }

    public String resolve(String explicitName) throws DatabaseResolutionException {
        if (isPresent(explicitName))
            return explicitName;
        if (isPresent(configuredName))
            return configuredName;

        List<Path> candidates;
        try {
            candidates = StorageUtils.listDatabaseFiles(dataDirectory);
        } catch (IOException e) {
            throw new DatabaseResolutionException("Could not scan " + dataDirectory + " for databases", e);
        }

        if (candidates.size() == 1)
            return candidates.get(0).getFileName().toString();
        if (candidates.isEmpty())
            throw new DatabaseResolutionException("No database specified and none found in " + dataDirectory);

        String names = candidates.stream()
                .map(p -> p.getFileName().toString())
                .collect(Collectors.joining(", "));
        throw new DatabaseResolutionException("No database specified and " + candidates.size()
                + " candidates found in " + dataDirectory + ": " + names);
    }

    /** Same as {@link #resolve} without the error. */
    public Optional<String> tryResolve(String explicitName) {
        try {
            return Optional.of(resolve(explicitName));
        } catch (DatabaseResolutionException e) {
            return Optional.empty();
        }
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }

    private static boolean isPresent(String name) {
        return name != null && !name.isBlank();
    }
}
