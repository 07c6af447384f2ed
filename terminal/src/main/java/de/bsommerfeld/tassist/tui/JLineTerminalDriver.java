package de.bsommerfeld.tassist.tui;

import org.jline.terminal.Attributes;
import org.jline.terminal.Size;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedString;
import org.jline.utils.Display;
import org.jline.utils.InfoCmp.Capability;
import org.jline.utils.NonBlockingReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * {@link TerminalDriver} on the system terminal via JLine.
 *
 * <p>
 * Opening the driver switches the terminal to raw mode and the alternate
 * screen; {@link #close()} restores both. Frames are drawn with JLine's
 * {@link Display}, which only rewrites changed rows.
 */
public final class JLineTerminalDriver implements TerminalDriver, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(JLineTerminalDriver.class);

    private static final Size FALLBACK_SIZE = new Size(100, 30);

    private final Terminal terminal;
    private final Attributes originalAttributes;
    private final Display display;
    private final KeyDecoder decoder;
    private Size size;

    private JLineTerminalDriver(Terminal terminal) {
        this.terminal = terminal;
        this.originalAttributes = terminal.enterRawMode();
        this.display = new Display(terminal, true);
        this.size = currentSize();
        display.resize(size.getRows(), size.getColumns());

        NonBlockingReader reader = terminal.reader();
        this.decoder = new KeyDecoder(new KeyDecoder.Input() {
            @Override
            public int read() throws IOException {
                return reader.read();
            }

            @Override
            public int read(long timeoutMs) throws IOException {
                return reader.read(timeoutMs);
            }
        });

        terminal.puts(Capability.enter_ca_mode);
        terminal.puts(Capability.cursor_invisible);
        terminal.puts(Capability.clear_screen);
        terminal.flush();
        LOG.debug("Terminal {} opened at {}x{}", terminal.getType(), size.getColumns(), size.getRows());
    }

    public static JLineTerminalDriver open() throws IOException {
        Terminal terminal = TerminalBuilder.builder()
                .system(true)
                .name("tacl")
                .build();
        return new JLineTerminalDriver(terminal);
    }

    @Override
    public int width() {
        return size.getColumns();
    }

    @Override
    public int height() {
        return size.getRows();
    }

    @Override
    public void draw(List<AttributedString> frame) {
        Size current = currentSize();
        if (!current.equals(size)) {
            size = current;
            display.clear();
            display.resize(size.getRows(), size.getColumns());
        }
        display.update(frame, size.cursorPos(size.getRows() - 1, 0));
        terminal.flush();
    }

    @Override
    public Optional<KeyStroke> readKey() throws IOException {
        return decoder.next();
    }

    @Override
    public void close() throws IOException {
        try {
            terminal.puts(Capability.clear_screen);
            terminal.puts(Capability.cursor_visible);
            terminal.puts(Capability.exit_ca_mode);
            terminal.flush();
            terminal.setAttributes(originalAttributes);
        } finally {
            terminal.close();
        }
    }

    private Size currentSize() {
        Size current = terminal.getSize();
        if (current == null || current.getRows() <= 0 || current.getColumns() <= 0) {
            return FALLBACK_SIZE;
        }
        return current;
    }
}
