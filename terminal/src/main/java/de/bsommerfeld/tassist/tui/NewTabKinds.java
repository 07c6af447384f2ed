package de.bsommerfeld.tassist.tui;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import de.bsommerfeld.tassist.core.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of tab kinds offered by the new-tab chooser, in registration order.
 * Registered as a resource by {@link TuiPlugin}.
 */
public final class NewTabKinds {

    private static final Logger LOG = LoggerFactory.getLogger(NewTabKinds.class);

    private final Map<String, TabKind<?>> kinds = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if a kind with the same name exists
     */
    public void register(TabKind<?> kind) {
        Preconditions.checkArgument(!kinds.containsKey(kind.name()), "tab kind already registered: %s", kind.name());
        kinds.put(kind.name(), kind);
        LOG.debug("Registered tab kind '{}'", kind.name());
    }

    /**
     * Registers {@code kind} if the terminal UI is part of this context, i.e.
     * {@link TuiPlugin} was added before the calling plugin.
     *
     * @return whether the kind was registered
     */
    public static boolean registerIfPresent(Context context, TabKind<?> kind) {
        Optional<NewTabKinds> catalog = context.getResource(NewTabKinds.class);
        catalog.ifPresent(c -> c.register(kind));
        return catalog.isPresent();
    }

    public List<TabKind<?>> kinds() {
        return ImmutableList.copyOf(kinds.values());
    }

    public Optional<TabKind<?>> get(String name) {
        return Optional.ofNullable(kinds.get(name));
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }
}
