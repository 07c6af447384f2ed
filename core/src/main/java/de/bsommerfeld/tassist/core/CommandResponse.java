package de.bsommerfeld.tassist.core;

import java.util.Optional;

/**
 * Result of a successful command: an optional human-readable text that the
 * front-end prints verbatim.
 */
public final class CommandResponse {

    private static final CommandResponse EMPTY = new CommandResponse(null);

    private final String text;

    private CommandResponse(String text) {
        this.text = text;
    }

    public static CommandResponse of(String text) {
        return new CommandResponse(text);
    }

    public static CommandResponse empty() {
        return EMPTY;
    }

    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    @Override
    public String toString() {
        return text == null ? "CommandResponse[]" : "CommandResponse[" + text + "]";
    }
}
