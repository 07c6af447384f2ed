package de.bsommerfeld.tassist.core;

import de.bsommerfeld.tassist.core.error.FrameworkException;

/**
 * A registration unit that extends a {@link Context} with commands, tables and
 * resources.
 *
 * <p>
 * {@link #build(Context)} runs exactly once, synchronously, when the plugin is
 * passed to {@link Context#addPlugin(Plugin)}. Plugins run in the order they
 * are added and may rely on resources registered by earlier plugins; each
 * implementation documents which ones. A plugin that cannot find a resource it
 * needs must fail through {@link Context#requireResource(Class)} instead of
 * silently skipping its registrations.
 */
@FunctionalInterface
public interface Plugin {

    void build(Context context) throws FrameworkException;
}
