package de.bsommerfeld.tassist.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Root of {@code config.toml}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("tui")
    private TuiConfig tui = new TuiConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public TuiConfig getTui() {
        return tui;
    }
}
