package de.bsommerfeld.tassist.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Optional;

/** The {@code [database]} section of {@code config.toml}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    @JsonProperty("in-memory")
    private boolean inMemory = false;

    /** Database file; blank means {@code <data dir>/data/data.db}. */
    @JsonProperty("path")
    private String path = "";

    public boolean isInMemory() {
        return inMemory;
    }

    public void setInMemory(boolean inMemory) {
        this.inMemory = inMemory;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Optional<Path> resolvedPath() {
        return path == null || path.isBlank() ? Optional.empty() : Optional.of(Path.of(path.trim()));
    }
}
