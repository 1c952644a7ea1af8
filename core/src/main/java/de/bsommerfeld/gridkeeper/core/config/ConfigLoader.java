package de.bsommerfeld.gridkeeper.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@code config.toml}. A missing file is created with the
 * defaults of {@link GridkeeperConfig} so users have something to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private ConfigLoader() {
    }

    public static GridkeeperConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            LOG.info("No configuration at {}, writing defaults", configPath);
            GridkeeperConfig defaults = new GridkeeperConfig();
            write(configPath, defaults);
            return defaults;
        }
        return MAPPER.readValue(configPath.toFile(), GridkeeperConfig.class);
    }

    public static void write(Path configPath, GridkeeperConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        MAPPER.writeValue(configPath.toFile(), config);
    }
}
