package de.bsommerfeld.tassist.tui;

import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The interactive loop of the terminal UI.
 *
 * <h3>States</h3>
 * <pre>
 * IDLE -&gt; RENDERING -&gt; AWAITING_INPUT -&gt; DISPATCHING -&gt; RENDERING ...
 *                                                    \-&gt; TERMINATED
 * </pre>
 * Each cycle draws one frame, blocks for one key and dispatches it. A key
 * matching a {@link GlobalBind} is handled by the session; otherwise it goes
 * to the selected tab if one of the tab's {@link KeyBind}s matches; anything
 * else is ignored. While the {@link Tui} is in text mode the selected tab gets
 * every key as typed input instead. The loop ends once {@link Tui#requestQuit()} was called or
 * the input ends.
 *
 * <h3>Errors</h3>
 * A tab failing to render or to handle a key does not end the session. The
 * error is logged and shown in the status line until the next key.
 *
 * <h3>Layout</h3>
 * Row 1 is the tab bar, row 2 a rule, then the selected tab's body, and the
 * last row the status line (keybind hints or the last error).
 */
public final class TuiSession {

    private static final Logger LOG = LoggerFactory.getLogger(TuiSession.class);

    private static final int CHROME_ROWS = 3;
    private static final String TEXT_HINTS = "Enter Confirm  Esc Cancel";

    public enum State {
        IDLE, RENDERING, AWAITING_INPUT, DISPATCHING, TERMINATED
    }

    /** Who handled a key. */
    public enum Dispatch {
        GLOBAL, TAB, TEXT, UNRECOGNIZED
    }

    private final Context context;
    private final Tui tui;
    private final boolean showKeybinds;

    private State state = State.IDLE;
    private String status;

    public TuiSession(Context context, Tui tui, boolean showKeybinds) {
        this.context = context;
        this.tui = tui;
        this.showKeybinds = showKeybinds;
    }

    /** Runs until quit is requested or the driver reports end of input. */
    public void run(TerminalDriver driver) throws IOException {
        LOG.info("Terminal session started with {} tab(s)", tui.tabs().size());
        while (state != State.TERMINATED) {
            state = State.RENDERING;
            driver.draw(render(driver.width(), driver.height()));
            if (tui.isQuitRequested()) {
                state = State.TERMINATED;
                break;
            }

            state = State.AWAITING_INPUT;
            Optional<KeyStroke> key = driver.readKey();
            if (key.isEmpty()) {
                LOG.info("Input closed, ending terminal session");
                tui.requestQuit();
                state = State.TERMINATED;
                break;
            }

            dispatch(key.get());
            if (tui.isQuitRequested()) {
                state = State.TERMINATED;
            }
        }
        LOG.info("Terminal session ended");
    }

    /** Routes one key: global binds first, then the selected tab's binds. */
    public Dispatch dispatch(KeyStroke key) {
        state = State.DISPATCHING;
        status = null;

        Optional<Tab> selected = tui.selectedTab();
        if (tui.inputMode() == Tui.InputMode.TEXT && selected.isPresent()) {
            Tab tab = selected.get();
            try {
                tab.kind().handleText(context, key, tab.id());
            } catch (FrameworkException e) {
                LOG.warn("Tab {} failed to take input {}", tab.id(), key, e);
                status = "error: " + e;
            }
            return Dispatch.TEXT;
        }

        Optional<GlobalBind> global = GlobalBind.match(key);
        if (global.isPresent()) {
            LOG.debug("Global bind {} ({})", global.get(), key);
            global.get().apply(context, tui);
            return Dispatch.GLOBAL;
        }

        if (selected.isPresent()) {
            Tab tab = selected.get();
            for (KeyBind bind : tab.kind().keybinds(context, tab.id())) {
                if (bind.key().equals(key)) {
                    LOG.debug("Tab {} bind '{}' ({})", tab.id(), bind.name(), key);
                    try {
                        tab.kind().handleKey(context, bind.name(), tab.id());
                    } catch (FrameworkException e) {
                        LOG.warn("Tab {} failed to handle '{}'", tab.id(), bind.name(), e);
                        status = "error: " + e;
                    }
                    return Dispatch.TAB;
                }
            }
        }
        LOG.trace("Unbound key {}", key);
        return Dispatch.UNRECOGNIZED;
    }

    /** Builds a full frame of exactly {@code height} rows. */
    public List<AttributedString> render(int width, int height) {
        int bodyRows = Math.max(0, height - CHROME_ROWS);
        List<AttributedString> frame = new ArrayList<>(height);
        frame.add(tabBar(width));
        frame.add(fit(new AttributedString("─".repeat(Math.max(0, width))), width));

        TabCanvas canvas = new TabCanvas(width);
        Optional<Tab> selected = tui.selectedTab();
        if (selected.isPresent()) {
            Tab tab = selected.get();
            try {
                tab.kind().render(context, canvas, tab.id());
            } catch (FrameworkException e) {
                LOG.warn("Tab {} failed to render", tab.id(), e);
                canvas.line("error: " + e);
            }
        } else {
            canvas.line("No open tabs. " + GlobalBind.NEW_TAB.key() + " opens one.");
        }

        List<AttributedString> body = canvas.lines();
        for (int i = 0; i < bodyRows; i++) {
            frame.add(i < body.size() ? body.get(i) : AttributedString.EMPTY);
        }
        frame.add(statusLine(width, selected));
        return frame.size() > height ? frame.subList(0, height) : frame;
    }

    public State state() {
        return state;
    }

    public Optional<String> status() {
        return Optional.ofNullable(status);
    }

    private AttributedString tabBar(int width) {
        AttributedStringBuilder bar = new AttributedStringBuilder();
        List<Tab> tabs = tui.tabs();
        for (int i = 0; i < tabs.size(); i++) {
            Tab tab = tabs.get(i);
            String title = " " + tab.kind().title(context, tab.id()) + " ";
            if (i == tui.selectedIndex()) {
                bar.styled(AttributedStyle.INVERSE, title);
            } else {
                bar.append(title);
            }
            bar.append("│");
        }
        return fit(bar.toAttributedString(), width);
    }

    private AttributedString statusLine(int width, Optional<Tab> selected) {
        if (status != null) {
            return fit(new AttributedString(status, AttributedStyle.DEFAULT.foreground(AttributedStyle.RED)), width);
        }
        if (!showKeybinds) {
            return AttributedString.EMPTY;
        }
        if (tui.inputMode() == Tui.InputMode.TEXT) {
            return fit(new AttributedString(TEXT_HINTS, AttributedStyle.DEFAULT.faint()), width);
        }
        StringBuilder hints = new StringBuilder();
        for (GlobalBind bind : GlobalBind.values()) {
            hints.append(bind.key()).append(' ').append(bind.label()).append("  ");
        }
        selected.ifPresent(tab -> {
            for (KeyBind bind : tab.kind().keybinds(context, tab.id())) {
                hints.append(bind.key()).append(' ').append(bind.label()).append("  ");
            }
        });
        return fit(new AttributedString(hints.toString().trim(), AttributedStyle.DEFAULT.faint()), width);
    }

    private static AttributedString fit(AttributedString line, int width) {
        return line.columnLength() > width ? line.columnSubSequence(0, width) : line;
    }
}
