package de.bsommerfeld.tassist.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The {@code [tui]} section of {@code config.toml}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TuiConfig {

    @JsonProperty("show-keybinds")
    private boolean showKeybinds = true;

    public boolean isShowKeybinds() {
        return showKeybinds;
    }

    public void setShowKeybinds(boolean showKeybinds) {
        this.showKeybinds = showKeybinds;
    }
}
