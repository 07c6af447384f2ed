package de.bsommerfeld.tassist.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.TableDescriptor;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import de.bsommerfeld.tassist.core.error.MissingResourceException;
import de.bsommerfeld.tassist.core.error.NoConnectionException;
import de.bsommerfeld.tassist.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The process-wide application state shared by command-line and terminal UI
 * front-ends.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li><strong>Construction</strong>: an empty context without plugins,
 * commands, tables or resources.</li>
 * <li><strong>Registration</strong>: {@link #addPlugin(Plugin)} runs each
 * plugin's {@code build} immediately; plugins call {@link #addCommand},
 * {@link #addTable} and {@link #addResource}.</li>
 * <li><strong>Startup</strong>: {@link #startup()} opens the SQLite
 * connection, runs every table's setup and registers the
 * {@link DbConnection} as a resource.</li>
 * <li><strong>Execution</strong>: {@link #execute(String)} routes command
 * strings to handlers, which receive this context.</li>
 * </ol>
 *
 * A context is confined to one thread. Commands run to completion before the
 * next one is accepted, so nothing in here is synchronized.
 *
 * <pre>
 * Context context = new Context();
 * context.inMemoryDb(true);
 * context.addPlugin(new TrainingPlugin())
 *        .addPlugin(new DbCommandsPlugin());
 * context.startup();
 * CommandResponse response = context.execute("new --table=trainer");
 * </pre>
 */
public class Context {

    private static final Logger LOG = LoggerFactory.getLogger(Context.class);

    public static final String APP_NAME = "training-assistant";

    private final Resources resources = new Resources();
    private final CommandRouter router = new CommandRouter();
    private final List<Plugin> plugins = new ArrayList<>();
    private final Map<String, TableDescriptor<?>> tables = new LinkedHashMap<>();

    private boolean openDbInMemory;
    private Path dbPath;

    /**
     * Registers a plugin and runs its {@link Plugin#build(Context)} right away.
     */
    public Context addPlugin(Plugin plugin) throws FrameworkException {
        Preconditions.checkNotNull(plugin, "plugin must not be null");
        LOG.debug("Building plugin {}", plugin.getClass().getSimpleName());
        plugins.add(plugin);
        plugin.build(this);
        return this;
    }

    /**
     * Registers a top-level command.
     *
     * @throws IllegalArgumentException if the command name is taken
     */
    public Context addCommand(CommandSpec command, CommandHandler handler) {
        router.register(command, handler);
        return this;
    }

    /**
     * Registers a table. Its setup runs on {@link #startup()}.
     *
     * @throws IllegalArgumentException if a table with the same name exists
     */
    public Context addTable(TableDescriptor<?> table) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkArgument(!tables.containsKey(table.tableName()),
                "table already registered: %s", table.tableName());
        tables.put(table.tableName(), table);
        LOG.debug("Registered table '{}' ({})", table.tableName(), table.rowType().getSimpleName());
        return this;
    }

    /** Opens the database in memory instead of a file. Defaults to {@code false}. */
    public void inMemoryDb(boolean inMemory) {
        this.openDbInMemory = inMemory;
    }

    /**
     * Overrides the database file location. Without an override the file lives
     * under the platform data directory, see {@link StorageUtils}.
     */
    public void dbPath(Path path) {
        this.dbPath = path;
    }

    // =====================================================================
    // Resources
    // =====================================================================

    /** Adds or replaces the resource of {@code resource}'s own type. */
    public <R> void addResource(R resource) {
        resources.add(resource);
    }

    public <R> Optional<R> getResource(Class<R> type) {
        return resources.get(type);
    }

    public boolean hasResource(Class<?> type) {
        return resources.has(type);
    }

    /**
     * Returns the resource of the given type, failing when no earlier plugin
     * registered it.
     */
    public <R> R requireResource(Class<R> type) throws MissingResourceException {
        return resources.get(type).orElseThrow(() -> new MissingResourceException(type));
    }

    /** The underlying registry, for generic resources keyed by a type token. */
    public Resources resources() {
        return resources;
    }

    // =====================================================================
    // Startup & execution
    // =====================================================================

    /**
     * Opens the database connection and creates every registered table that
     * does not exist yet. Call after all plugins have been added.
     */
    public void startup() throws FrameworkException {
        Optional<DbConnection> existing = resources.get(DbConnection.class);
        if (existing.isPresent() && existing.get().isOpen()) {
            throw new IllegalStateException("context already started");
        }

        List<TableDescriptor<?>> tableList = ImmutableList.copyOf(tables.values());
        DbConnection connection = openDbInMemory
                ? DbConnection.openInMemory(tableList)
                : DbConnection.openFile(dbPath != null ? dbPath : defaultDbPath(), tableList);
        resources.add(connection);
        LOG.info("Context started with {} plugin(s), {} command(s), {} table(s)",
                plugins.size(), router.commandNames().size(), tables.size());
    }

    /**
     * Routes a command string such as {@code new --table=trainer} to its
     * handler.
     */
    public CommandResponse execute(String command) throws FrameworkException {
        return router.execute(this, command);
    }

    /**
     * The connection opened by {@link #startup()}. It may have been closed
     * since; row operations on a closed connection fail with
     * {@link NoConnectionException}.
     */
    public DbConnection dbConnection() throws NoConnectionException {
        return resources.get(DbConnection.class).orElseThrow(NoConnectionException::new);
    }

    public List<String> commandNames() {
        return router.commandNames();
    }

    public List<TableDescriptor<?>> tables() {
        return ImmutableList.copyOf(tables.values());
    }

    public int pluginCount() {
        return plugins.size();
    }

    static Path defaultDbPath() {
        return StorageUtils.getAppDataDir(APP_NAME).resolve("data").resolve("data.db");
    }
}
