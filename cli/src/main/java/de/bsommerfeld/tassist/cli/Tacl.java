package de.bsommerfeld.tassist.cli;

import com.google.common.base.CharMatcher;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import de.bsommerfeld.tassist.core.CommandResponse;
import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.config.AppConfig;
import de.bsommerfeld.tassist.core.config.ApplicationMode;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.error.DatabaseException;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import de.bsommerfeld.tassist.core.util.StorageUtils;
import de.bsommerfeld.tassist.tui.JLineTerminalDriver;
import de.bsommerfeld.tassist.tui.Tui;
import de.bsommerfeld.tassist.tui.TuiSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point of the {@code tacl} command.
 *
 * <p>
 * The process arguments are joined back into one command string, with
 * quoting where needed, and executed against the context. The response text
 * is printed as is; failures are printed as {@code error: <exception>}, the
 * exception type followed by its message. When the command opened a terminal
 * UI ({@code tacl tui}), the interactive session runs until the user quits. The database connection is closed on the way
 * out.
 */
public final class Tacl {

    static {
        // Initialize Logging Directory via StorageUtils
        Path logDir = StorageUtils.getLogsDir(Context.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory: " + logDir);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(Tacl.class);

    private static final CharMatcher PLAIN = CharMatcher.whitespace().or(CharMatcher.anyOf("\"'\\")).negate();

    private final Context context;
    private final AppConfig config;

    @Inject
    Tacl(Context context, AppConfig config) {
        this.context = context;
        this.config = config;
    }

    public static void main(String[] args) {
        int status;
        try {
            Injector injector = Guice.createInjector(
                    new CliModule(ApplicationMode.get(), StorageUtils.getConfigFile(Context.APP_NAME)));
            status = injector.getInstance(Tacl.class).run(args, System.out);
        } catch (CreationException | ProvisionException e) {
            LOG.error("Startup failed", e);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            System.out.println("error: " + cause);
            status = 1;
        }
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Executes one command and, if it asked for one, the terminal session.
     *
     * @return the process exit status
     */
    int run(String[] args, PrintStream out) {
        String command = args.length == 0 ? "--help" : join(args);
        LOG.info("Executing '{}'", command);
        try {
            CommandResponse response = context.execute(command);
            response.text().ifPresent(out::println);
            Optional<Tui> tui = context.getResource(Tui.class);
            if (tui.isPresent()) {
                return runSession(tui.get(), out);
            }
            return 0;
        } catch (FrameworkException e) {
            LOG.warn("Command '{}' failed", command, e);
            out.println("error: " + e);
            return 1;
        } finally {
            closeDatabase();
        }
    }

    private int runSession(Tui tui, PrintStream out) {
        try (JLineTerminalDriver driver = JLineTerminalDriver.open()) {
            new TuiSession(context, tui, config.getTui().isShowKeybinds()).run(driver);
            return 0;
        } catch (IOException e) {
            LOG.error("Terminal session failed", e);
            out.println("error: terminal session failed: " + e.getMessage());
            return 1;
        }
    }

    private void closeDatabase() {
        Optional<DbConnection> db = context.getResource(DbConnection.class);
        if (db.isEmpty()) {
            return;
        }
        try {
            db.get().close();
        } catch (DatabaseException e) {
            LOG.warn("Failed to close database connection", e);
        }
    }

    /** Joins process arguments so that the command tokenizer splits them the same way again. */
    static String join(String[] args) {
        return Arrays.stream(args).map(Tacl::quote).collect(Collectors.joining(" "));
    }

    private static String quote(String arg) {
        if (!arg.isEmpty() && PLAIN.matchesAllOf(arg)) {
            return arg;
        }
        return "\"" + arg.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
