package de.bsommerfeld.tassist.tui;

import com.google.common.reflect.TypeParameter;
import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.Resources;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Access to tab state stored in the context's {@link Resources}.
 *
 * <p>
 * The arena for state type {@code S} is registered under
 * {@code TypeToken<TabStateArena<S>>}, so arenas of different state types never
 * collide even though they share one runtime class. An arena is created the
 * first time a tab of a kind with that state type opens.
 *
 * <pre>
 * EditState state = TabStates.get(context, this, tabId);
 * TabStates.update(context, this, tabId, s -&gt; s.moveDown());
 * </pre>
 */
public final class TabStates {

    private TabStates() {
    }

    public static <S> TypeToken<TabStateArena<S>> arenaType(TypeToken<S> stateType) {
        return new TypeToken<TabStateArena<S>>() {
        }.where(new TypeParameter<S>() {
        }, stateType);
    }

    /** The arena for {@code kind}'s state type, created if missing. */
    public static <S> TabStateArena<S> arena(Context context, TabKind<S> kind) {
        TypeToken<TabStateArena<S>> key = arenaType(kind.stateType());
        Optional<TabStateArena<S>> existing = context.resources().get(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        TabStateArena<S> arena = new TabStateArena<>();
        context.resources().add(key, arena);
        return arena;
    }

    public static <S> Optional<TabStateArena<S>> existingArena(Context context, TypeToken<S> stateType) {
        return context.resources().get(arenaType(stateType));
    }

    /**
     * @throws IllegalStateException if the tab has no state of this kind
     */
    public static <S> S get(Context context, TabKind<S> kind, int tabId) {
        return arena(context, kind).get(tabId);
    }

    public static <S> void set(Context context, TabKind<S> kind, int tabId, S state) {
        arena(context, kind).replace(tabId, state);
    }

    /** Replaces the tab's state with {@code change} applied to it and returns the result. */
    public static <S> S update(Context context, TabKind<S> kind, int tabId, UnaryOperator<S> change) {
        TabStateArena<S> arena = arena(context, kind);
        S next = change.apply(arena.get(tabId));
        arena.replace(tabId, next);
        return next;
    }

    static <S> void open(Context context, TabKind<S> kind, int tabId) {
        arena(context, kind).insert(tabId, kind.initialState());
    }

    static <S> void discard(Context context, TabKind<S> kind, int tabId) {
        existingArena(context, kind.stateType()).ifPresent(arena -> arena.remove(tabId));
    }
}
