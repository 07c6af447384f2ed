package de.bsommerfeld.tassist.tui;

import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.Context;

import java.util.List;

/** Base for tab kinds that keep nothing per tab and react to no keys. */
public abstract class StatelessTab implements TabKind<StatelessTab.NoState> {

    public enum NoState {
        INSTANCE
    }

    @Override
    public List<KeyBind> keybinds(Context context, int tabId) {
        return List.of();
    }

    @Override
    public void handleKey(Context context, String bindName, int tabId) {
        throw new IllegalArgumentException(name() + " has no bind " + bindName);
    }

    @Override
    public final TypeToken<NoState> stateType() {
        return TypeToken.of(NoState.class);
    }

    @Override
    public final NoState initialState() {
        return NoState.INSTANCE;
    }
}
