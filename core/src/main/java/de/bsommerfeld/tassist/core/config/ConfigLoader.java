package de.bsommerfeld.tassist.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.tassist.core.error.FileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link AppConfig} from a TOML file. A missing file is created with the
 * defaults; missing keys keep their defaults.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper = new TomlMapper();

    public AppConfig load(Path file) throws FileException {
        if (!Files.exists(file)) {
            AppConfig defaults = new AppConfig();
            save(file, defaults);
            LOG.info("Wrote default configuration to {}", file);
            return defaults;
        }
        try {
            AppConfig config = mapper.readValue(file.toFile(), AppConfig.class);
            LOG.info("Loaded configuration from {}", file);
            return config;
        } catch (IOException e) {
            throw new FileException("failed to read configuration " + file + ": " + e.getMessage(), e);
        }
    }

    public void save(Path file, AppConfig config) throws FileException {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), config);
        } catch (IOException e) {
            throw new FileException("failed to write configuration " + file, e);
        }
    }
}
