package de.bsommerfeld.tassist.tui;

import de.bsommerfeld.tassist.core.CommandResponse;
import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.Plugin;
import picocli.CommandLine.Model.CommandSpec;

/**
 * Adds the terminal UI to a context.
 *
 * <p>
 * Registers the {@link NewTabKinds} catalog and the {@code tui} command. The
 * command opens a {@link Tui} with one empty tab and puts it into the context;
 * the front-end starts a {@link TuiSession} when it finds it there.
 *
 * <p>
 * Add this plugin <em>before</em> plugins that contribute tab kinds; they only
 * register their tabs when the catalog already exists.
 */
public final class TuiPlugin implements Plugin {

    static final String COMMAND = "tui";
    static final String OPENING = "Opening TUI session...";

    @Override
    public void build(Context context) {
        context.addResource(new NewTabKinds());

        CommandSpec spec = CommandSpec.create().name(COMMAND);
        spec.usageMessage().description("Open the interactive terminal UI");
        context.addCommand(spec, (ctx, args) -> {
            Tui tui = new Tui();
            tui.addTab(ctx, EmptyTab.INSTANCE);
            ctx.addResource(tui);
            return CommandResponse.of(OPENING);
        });
    }
}
