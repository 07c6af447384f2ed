package de.bsommerfeld.tassist.tui;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import de.bsommerfeld.tassist.core.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The open tabs of a terminal session, the selection and the quit flag.
 * Registered as a context resource by the {@code tui} command; its presence
 * tells the front-end to start a {@link TuiSession}.
 *
 * <p>
 * Tab ids increase monotonically and are never reused. Opening, replacing and
 * closing a tab always creates or drops its state in the same call, so a tab
 * and its state never exist without each other.
 *
 * <p>
 * In {@link InputMode#TEXT} every key goes to the selected tab's
 * {@link TabKind#handleText}, global binds included. Replacing or closing a
 * tab falls back to {@link InputMode#BIND}.
 */
public final class Tui {

    private static final Logger LOG = LoggerFactory.getLogger(Tui.class);

    public enum InputMode {
        BIND, TEXT
    }

    private final List<Tab> tabs = new ArrayList<>();
    private int nextId;
    private int selected;
    private boolean quitRequested;
    private InputMode inputMode = InputMode.BIND;

    /**
     * Opens a tab of {@code kind} at the end of the tab bar with the kind's
     * initial state. The selection does not move.
     *
     * @return the new tab's id
     */
    public int addTab(Context context, TabKind<?> kind) {
        Preconditions.checkNotNull(kind, "kind must not be null");
        int id = nextId++;
        TabStates.open(context, kind, id);
        tabs.add(new Tab(id, kind));
        LOG.debug("Opened tab {} ({})", id, kind.name());
        return id;
    }

    /**
     * Shows {@code kind} in an existing tab. The old state is dropped and the
     * tab starts over with {@code kind}'s initial state, even if the kind is
     * unchanged.
     *
     * @throws IllegalArgumentException if no tab has this id
     */
    public void setTab(Context context, int tabId, TabKind<?> kind) {
        Preconditions.checkNotNull(kind, "kind must not be null");
        int index = indexOf(tabId);
        TabStates.discard(context, tabs.get(index).kind(), tabId);
        TabStates.open(context, kind, tabId);
        tabs.set(index, new Tab(tabId, kind));
        inputMode = InputMode.BIND;
        LOG.debug("Tab {} now shows {}", tabId, kind.name());
    }

    /** Replaces the tab's content with the new-tab chooser. */
    public void clearTab(Context context, int tabId) {
        setTab(context, tabId, EmptyTab.INSTANCE);
    }

    /**
     * Closes a tab and drops its state. The selection stays on the same
     * position, or moves to the last tab when the closed tab was the last one.
     */
    public void closeTab(Context context, int tabId) {
        int index = indexOf(tabId);
        Tab removed = tabs.remove(index);
        TabStates.discard(context, removed.kind(), tabId);
        inputMode = InputMode.BIND;
        if (selected >= tabs.size()) {
            selected = Math.max(0, tabs.size() - 1);
        }
        LOG.debug("Closed tab {}", tabId);
    }

    public void selectNext() {
        if (!tabs.isEmpty()) {
            selected = Math.floorMod(selected + 1, tabs.size());
        }
    }

    public void selectPrevious() {
        if (!tabs.isEmpty()) {
            selected = Math.floorMod(selected - 1, tabs.size());
        }
    }

    public void select(int tabId) {
        selected = indexOf(tabId);
    }

    public Optional<Tab> selectedTab() {
        return tabs.isEmpty() ? Optional.empty() : Optional.of(tabs.get(selected));
    }

    public int selectedIndex() {
        return selected;
    }

    public List<Tab> tabs() {
        return ImmutableList.copyOf(tabs);
    }

    public Optional<Tab> tab(int tabId) {
        return tabs.stream().filter(t -> t.id() == tabId).findFirst();
    }

    public InputMode inputMode() {
        return inputMode;
    }

    public void setInputMode(InputMode mode) {
        this.inputMode = Preconditions.checkNotNull(mode, "mode must not be null");
    }

    public void requestQuit() {
        quitRequested = true;
    }

    public boolean isQuitRequested() {
        return quitRequested;
    }

    private int indexOf(int tabId) {
        for (int i = 0; i < tabs.size(); i++) {
            if (tabs.get(i).id() == tabId) {
                return i;
            }
        }
        throw new IllegalArgumentException("no tab with id " + tabId);
    }
}
