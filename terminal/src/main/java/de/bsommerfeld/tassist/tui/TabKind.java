package de.bsommerfeld.tassist.tui;

import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.error.FrameworkException;

import java.util.List;

/**
 * Behaviour of one kind of tab.
 *
 * <p>
 * The session loop only talks to tabs through this interface, so new kinds can
 * be contributed by plugins without touching the loop. A kind is a stateless
 * singleton; everything that belongs to one open tab lives in a state value of
 * type {@code S}, kept in the {@link TabStateArena} for {@code S} and looked up
 * with the tab id, see {@link TabStates}.
 *
 * @param <S> the per-tab state type
 */
public interface TabKind<S> {

    /** Name in the new-tab chooser. Unique among registered kinds. */
    String name();

    /** Title in the tab bar. */
    default String title(Context context, int tabId) {
        return name();
    }

    void render(Context context, TabCanvas canvas, int tabId) throws FrameworkException;

    /** The binds active for the tab right now. Global binds shadow these. */
    List<KeyBind> keybinds(Context context, int tabId);

    /**
     * Runs the action of the bind named {@code bindName}, one of the names
     * returned by {@link #keybinds}.
     */
    void handleKey(Context context, String bindName, int tabId) throws FrameworkException;

    /**
     * Receives every key while the session is in {@link Tui.InputMode#TEXT}.
     * Kinds that never switch to text mode can ignore this.
     */
    default void handleText(Context context, KeyStroke key, int tabId) throws FrameworkException {
    }

    TypeToken<S> stateType();

    /** State of a freshly opened tab. Must not be {@code null}. */
    S initialState();
}
