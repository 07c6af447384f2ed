package de.bsommerfeld.tassist.core;

import de.bsommerfeld.tassist.core.error.FrameworkException;
import picocli.CommandLine.ParseResult;

/**
 * Callback invoked by the command router for one registered command.
 *
 * <p>
 * {@code args} is the picocli parse result of the handler's own command, not of
 * the root, so {@code args.matchedOptionValue("table", null)} reads the
 * command's {@code --table} option directly. Commands with nested subcommands
 * inspect {@link ParseResult#subcommand()} themselves.
 */
@FunctionalInterface
public interface CommandHandler {

    CommandResponse process(Context context, ParseResult args) throws FrameworkException;
}
