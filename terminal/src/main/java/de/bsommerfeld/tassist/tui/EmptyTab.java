package de.bsommerfeld.tassist.tui;

import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.Context;

import java.util.List;

/**
 * Content of a new or cleared tab: a chooser listing the registered
 * {@link NewTabKinds}. Selecting one replaces this tab with that kind.
 */
public final class EmptyTab implements TabKind<EmptyTab.State> {

    public static final EmptyTab INSTANCE = new EmptyTab();

    static final String MOVE_UP = "move_up";
    static final String MOVE_DOWN = "move_down";
    static final String SELECT = "select";

    private static final List<KeyBind> KEYBINDS = List.of(
            KeyBind.of(MOVE_UP, "Up", KeyStroke.of(KeyStroke.Key.UP)),
            KeyBind.of(MOVE_DOWN, "Down", KeyStroke.of(KeyStroke.Key.DOWN)),
            KeyBind.of(SELECT, "Open", KeyStroke.of(KeyStroke.Key.ENTER)));

    /** Index of the highlighted kind. */
    public record State(int cursor) {
    }

    private EmptyTab() {
    }

    @Override
    public String name() {
        return "Empty";
    }

    @Override
    public String title(Context context, int tabId) {
        return "New Tab";
    }

    @Override
    public void render(Context context, TabCanvas canvas, int tabId) {
        List<TabKind<?>> kinds = kinds(context);
        if (kinds.isEmpty()) {
            canvas.line("No creatable tab types.");
            return;
        }
        int cursor = TabStates.get(context, this, tabId).cursor();
        canvas.line("Open a tab:").blank();
        for (int i = 0; i < kinds.size(); i++) {
            String entry = "  " + kinds.get(i).name();
            if (i == cursor) {
                canvas.highlighted(entry);
            } else {
                canvas.line(entry);
            }
        }
    }

    @Override
    public List<KeyBind> keybinds(Context context, int tabId) {
        return KEYBINDS;
    }

    @Override
    public void handleKey(Context context, String bindName, int tabId) {
        List<TabKind<?>> kinds = kinds(context);
        if (kinds.isEmpty()) {
            return;
        }
        switch (bindName) {
            case MOVE_UP:
                TabStates.update(context, this, tabId, s -> new State(Math.max(0, s.cursor() - 1)));
                break;
            case MOVE_DOWN:
                TabStates.update(context, this, tabId, s -> new State(Math.min(kinds.size() - 1, s.cursor() + 1)));
                break;
            case SELECT:
                int cursor = Math.min(TabStates.get(context, this, tabId).cursor(), kinds.size() - 1);
                context.getResource(Tui.class)
                        .orElseThrow(() -> new IllegalStateException("no terminal session"))
                        .setTab(context, tabId, kinds.get(cursor));
                break;
            default:
                throw new IllegalArgumentException("unknown bind " + bindName);
        }
    }

    @Override
    public TypeToken<State> stateType() {
        return TypeToken.of(State.class);
    }

    @Override
    public State initialState() {
        return new State(0);
    }

    private static List<TabKind<?>> kinds(Context context) {
        return context.getResource(NewTabKinds.class).map(NewTabKinds::kinds).orElse(List.of());
    }
}
