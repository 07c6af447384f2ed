package de.bsommerfeld.tassist.tui;

import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Line buffer a tab renders its body into. Lines longer than the canvas are
 * cut at {@link #width()}.
 */
public final class TabCanvas {

    private final int width;
    private final List<AttributedString> lines = new ArrayList<>();

    public TabCanvas(int width) {
        this.width = Math.max(1, width);
    }

    public int width() {
        return width;
    }

    public TabCanvas line(String text) {
        return styled(text, AttributedStyle.DEFAULT);
    }

    /** A line in inverse video, used for the cursor row. */
    public TabCanvas highlighted(String text) {
        return styled(text, AttributedStyle.INVERSE);
    }

    public TabCanvas styled(String text, AttributedStyle style) {
        for (String part : text.split("\n", -1)) {
            AttributedString line = new AttributedString(part, style);
            lines.add(line.columnLength() > width ? line.columnSubSequence(0, width) : line);
        }
        return this;
    }

    public TabCanvas blank() {
        lines.add(AttributedString.EMPTY);
        return this;
    }

    public List<AttributedString> lines() {
        return Collections.unmodifiableList(lines);
    }

    /** The content without styles, lines joined by {@code \n}. */
    public String plainText() {
        return lines.stream().map(AttributedString::toString).collect(Collectors.joining("\n"));
    }
}
