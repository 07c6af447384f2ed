package de.bsommerfeld.tassist.tui;

import org.jline.utils.AttributedString;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/** The screen and keyboard a {@link TuiSession} runs on. */
public interface TerminalDriver {

    int width();

    int height();

    /** Replaces the screen content with {@code frame}, one entry per row. */
    void draw(List<AttributedString> frame) throws IOException;

    /**
     * Blocks until the next key press.
     *
     * @return the key, or empty at end of input
     */
    Optional<KeyStroke> readKey() throws IOException;
}
