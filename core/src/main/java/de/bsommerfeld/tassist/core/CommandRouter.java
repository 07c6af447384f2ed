package de.bsommerfeld.tassist.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import de.bsommerfeld.tassist.core.error.InvalidArgumentsException;
import de.bsommerfeld.tassist.core.error.UnknownCommandException;
import org.jline.reader.ParsedLine;
import org.jline.reader.Parser;
import org.jline.reader.SyntaxError;
import org.jline.reader.impl.DefaultParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.UnmatchedArgumentException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches command strings against the commands registered by plugins and runs
 * the one matching handler.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>The string is split into words by JLine's {@link DefaultParser}, which
 * applies shell-like quoting and backslash escapes.</li>
 * <li>The words are parsed by picocli against a root command ({@code tacl})
 * whose subcommands are the registered {@link CommandSpec}s. The tree is
 * assembled on first use; later registrations are attached to it.</li>
 * <li>The handler registered for the matched top-level command receives that
 * command's {@link ParseResult}. Exactly one handler runs per call and its
 * exceptions propagate unchanged.</li>
 * </ol>
 *
 * Unmatched input is always an error: an unknown command or subcommand raises
 * {@link UnknownCommandException}; a recognized command with unknown options or
 * unusable arguments raises {@link InvalidArgumentsException}.
 */
public final class CommandRouter {

    private static final Logger LOG = LoggerFactory.getLogger(CommandRouter.class);

    static final String ROOT_NAME = "tacl";
    static final String VERSION = "tacl 0.1.0";

    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private final DefaultParser lexer = new DefaultParser();
    private CommandLine root;

    public CommandRouter() {
        lexer.setEofOnUnclosedQuote(true);
    }

    /**
     * Adds a top-level command. Standard {@code --help}/{@code --version}
     * options are mixed into the command.
     *
     * @throws IllegalArgumentException if a command with the same name exists
     */
    public void register(CommandSpec spec, CommandHandler handler) {
        Preconditions.checkNotNull(spec, "spec must not be null");
        Preconditions.checkNotNull(handler, "handler must not be null");
        Preconditions.checkArgument(spec.name() != null && !spec.name().isBlank(),
                "command must have a name");
        Preconditions.checkArgument(!registrations.containsKey(spec.name()),
                "command already registered: %s", spec.name());

        spec.mixinStandardHelpOptions(true);
        registrations.put(spec.name(), new Registration(spec, handler));
        if (root != null) {
            root.addSubcommand(spec.name(), spec);
        }
        LOG.debug("Registered command '{}'", spec.name());
    }

    /** Names of the registered top-level commands, in registration order. */
    public List<String> commandNames() {
        return ImmutableList.copyOf(registrations.keySet());
    }

    /**
     * Tokenizes, parses and dispatches {@code commandString}.
     *
     * @return the handler's response, or usage/version text when help was
     *         requested
     */
    public CommandResponse execute(Context context, String commandString) throws FrameworkException {
        List<String> words = tokenize(commandString);
        if (words.isEmpty()) {
            throw new UnknownCommandException("no command given");
        }

        CommandLine commandLine = root();
        ParseResult parsed;
        try {
            parsed = commandLine.parseArgs(words.toArray(new String[0]));
        } catch (UnmatchedArgumentException e) {
            List<String> unmatched = e.getUnmatched();
            if (!unmatched.isEmpty() && unmatched.get(0).startsWith("-")) {
                throw new InvalidArgumentsException(e.getMessage(), e);
            }
            throw new UnknownCommandException(e.getMessage(), e);
        } catch (ParameterException e) {
            throw new InvalidArgumentsException(e.getMessage(), e);
        }

        if (parsed.isUsageHelpRequested()) {
            return CommandResponse.of(commandLine.getUsageMessage());
        }
        if (parsed.isVersionHelpRequested()) {
            return CommandResponse.of(VERSION);
        }
        if (!parsed.hasSubcommand()) {
            throw new UnknownCommandException("command not recognized: " + words.get(0));
        }

        ParseResult commandResult = parsed.subcommand();
        if (commandResult.isUsageHelpRequested()) {
            return CommandResponse.of(commandResult.commandSpec().commandLine().getUsageMessage());
        }
        if (commandResult.isVersionHelpRequested()) {
            return CommandResponse.of(VERSION);
        }

        Registration registration = registrations.get(commandResult.commandSpec().name());
        if (registration == null) {
            throw new UnknownCommandException("command not recognized: " + commandResult.commandSpec().name());
        }
        LOG.debug("Dispatching '{}'", registration.spec().name());
        return registration.handler().process(context, commandResult);
    }

    private List<String> tokenize(String commandString) throws InvalidArgumentsException {
        if (commandString == null || commandString.isBlank()) {
            return List.of();
        }
        String line = commandString.trim();
        try {
            ParsedLine parsedLine = lexer.parse(line, line.length(), Parser.ParseContext.ACCEPT_LINE);
            return parsedLine.words();
        } catch (SyntaxError e) {
            throw new InvalidArgumentsException("malformed command string: " + e.getMessage(), e);
        }
    }

    private CommandLine root() {
        if (root == null) {
            CommandSpec rootSpec = CommandSpec.create()
                    .name(ROOT_NAME)
                    .version(VERSION)
                    .mixinStandardHelpOptions(true);
            rootSpec.usageMessage().description("Command line interface for Training Assistant");
            CommandLine commandLine = new CommandLine(rootSpec);
            for (Registration registration : registrations.values()) {
                commandLine.addSubcommand(registration.spec().name(), registration.spec());
            }
            root = commandLine;
        }
        return root;
    }

    private record Registration(CommandSpec spec, CommandHandler handler) {
    }
}
