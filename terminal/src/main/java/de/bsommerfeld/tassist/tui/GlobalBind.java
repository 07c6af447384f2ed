package de.bsommerfeld.tassist.tui;

import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.tui.KeyStroke.Key;

import java.util.Optional;

/**
 * Session-wide binds. They are matched before the selected tab's binds, so a
 * tab cannot take over these keys.
 */
public enum GlobalBind {

    QUIT("Quit", KeyStroke.of('q')) {
        @Override
        void apply(Context context, Tui tui) {
            tui.requestQuit();
        }
    },
    PREVIOUS_TAB("Prev tab", KeyStroke.ctrl(Key.LEFT)) {
        @Override
        void apply(Context context, Tui tui) {
            tui.selectPrevious();
        }
    },
    NEXT_TAB("Next tab", KeyStroke.ctrl(Key.RIGHT)) {
        @Override
        void apply(Context context, Tui tui) {
            tui.selectNext();
        }
    },
    NEW_TAB("New tab", KeyStroke.ctrl('t')) {
        @Override
        void apply(Context context, Tui tui) {
            tui.select(tui.addTab(context, EmptyTab.INSTANCE));
        }
    },
    CLOSE_TAB("Close tab", KeyStroke.ctrl('w')) {
        @Override
        void apply(Context context, Tui tui) {
            tui.selectedTab().ifPresent(tab -> tui.closeTab(context, tab.id()));
        }
    },
    CLEAR_TAB("Clear tab", KeyStroke.ctrl('e')) {
        @Override
        void apply(Context context, Tui tui) {
            tui.selectedTab().ifPresent(tab -> tui.clearTab(context, tab.id()));
        }
    };

    private final String label;
    private final KeyStroke key;

    GlobalBind(String label, KeyStroke key) {
        this.label = label;
        this.key = key;
    }

    public String label() {
        return label;
    }

    public KeyStroke key() {
        return key;
    }

    abstract void apply(Context context, Tui tui);

    public static Optional<GlobalBind> match(KeyStroke stroke) {
        for (GlobalBind bind : values()) {
            if (bind.key.equals(stroke)) {
                return Optional.of(bind);
            }
        }
        return Optional.empty();
    }
}
