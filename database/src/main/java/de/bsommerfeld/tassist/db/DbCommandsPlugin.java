package de.bsommerfeld.tassist.db;

import de.bsommerfeld.tassist.core.CommandResponse;
import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.Plugin;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.FieldInfo;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.db.TableDescriptor;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import de.bsommerfeld.tassist.core.error.InvalidArgumentsException;
import de.bsommerfeld.tassist.core.error.UnknownCommandException;
import de.bsommerfeld.tassist.tui.NewTabKinds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.ParseResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Commands for editing rows and maintaining the database file.
 *
 * <h3>Commands</h3>
 * <ul>
 * <li>{@code new --table T}: inserts an empty row</li>
 * <li>{@code remove|rm --table T --row-id N}</li>
 * <li>{@code set --table T --row-id N --field F --value V}: the value is
 * parsed according to the field's declared type</li>
 * <li>{@code list|ls --table T}: all rows as an ASCII grid</li>
 * <li>{@code db info|erase|backup --out-file P|restore --file P}</li>
 * </ul>
 *
 * Table names must belong to a registered table, and field names to one of
 * its columns; names go into SQL text, so nothing else is let through.
 *
 * <p>
 * When the {@code TuiPlugin} ran before this plugin, the "Database Info" and
 * "Edit Table" tab kinds are offered in the new-tab chooser.
 */
public final class DbCommandsPlugin implements Plugin {

    private static final Logger LOG = LoggerFactory.getLogger(DbCommandsPlugin.class);

    @Override
    public void build(Context context) {
        context.addCommand(command("new", "Add a new row to a table")
                        .addOption(option("--table", "TABLE", String.class, "Name of the table to add a row in")),
                        DbCommandsPlugin::newRow)
                .addCommand(command("remove", "Removes a row from a table")
                        .aliases("rm")
                        .addOption(option("--table", "TABLE", String.class, "Name of the table to remove a row from"))
                        .addOption(option("--row-id", "ID", Long.class, "Row ID to remove")),
                        DbCommandsPlugin::removeRow)
                .addCommand(command("set", "Sets a field in the given table and row")
                        .addOption(option("--table", "TABLE", String.class, "Name of the table to modify"))
                        .addOption(option("--row-id", "ID", Long.class, "Row ID to modify"))
                        .addOption(option("--field", "FIELD", String.class, "Name of the field to modify"))
                        .addOption(option("--value", "VALUE", String.class, "Value to set the field to")),
                        DbCommandsPlugin::setField)
                .addCommand(command("list", "Lists the rows of a table")
                        .aliases("ls")
                        .addOption(option("--table", "TABLE", String.class, "Name of the table to list rows from")),
                        DbCommandsPlugin::listRows)
                .addCommand(dbCommand(), DbCommandsPlugin::db);

        boolean info = NewTabKinds.registerIfPresent(context, DbInfoTab.INSTANCE);
        boolean edit = NewTabKinds.registerIfPresent(context, EditTableTab.INSTANCE);
        if (!info || !edit) {
            LOG.debug("No terminal UI registered, database tabs not offered");
        }
    }

    // =====================================================================
    // Command specs
    // =====================================================================

    private static CommandSpec command(String name, String description) {
        CommandSpec spec = CommandSpec.create().name(name);
        spec.usageMessage().description(description);
        return spec;
    }

    private static OptionSpec option(String name, String label, Class<?> type, String description) {
        return OptionSpec.builder(name)
                .paramLabel(label)
                .type(type)
                .required(true)
                .description(description)
                .build();
    }

    private static CommandSpec dbCommand() {
        CommandSpec db = command("db", "View and update database configuration");
        db.addSubcommand("info", new CommandLine(command("info", "Prints information about the database")));
        db.addSubcommand("erase", new CommandLine(command("erase", "Erases the database")));
        db.addSubcommand("backup", new CommandLine(command("backup", "Copies the database to a new file")
                .addOption(option("--out-file", "PATH", String.class,
                        "File path to copy the database to (will be overwritten)"))));
        db.addSubcommand("restore", new CommandLine(command("restore", "Restores the database from a given file")
                .addOption(option("--file", "PATH", String.class, "File path to restore the database from"))));
        return db;
    }

    // =====================================================================
    // Handlers
    // =====================================================================

    private static CommandResponse newRow(Context context, ParseResult args) throws FrameworkException {
        DbConnection db = context.dbConnection();
        TableDescriptor<?> table = table(db, args.matchedOptionValue("--table", ""));
        RowId id = db.newRow(table.tableName());
        return CommandResponse.of("Inserted new row (id: " + id + ") in table " + table.tableName() + ".");
    }

    private static CommandResponse removeRow(Context context, ParseResult args) throws FrameworkException {
        DbConnection db = context.dbConnection();
        TableDescriptor<?> table = table(db, args.matchedOptionValue("--table", ""));
        db.removeRow(table.tableName(), RowId.of(args.matchedOptionValue("--row-id", 0L)));
        return CommandResponse.empty();
    }

    private static CommandResponse setField(Context context, ParseResult args) throws FrameworkException {
        DbConnection db = context.dbConnection();
        TableDescriptor<?> table = table(db, args.matchedOptionValue("--table", ""));
        RowId row = RowId.of(args.matchedOptionValue("--row-id", 0L));
        FieldInfo field = field(table, args.matchedOptionValue("--field", ""));
        Object value = FieldParser.parse(field, args.matchedOptionValue("--value", ""));
        db.setField(table.tableName(), row, field.column(), value);
        return CommandResponse.empty();
    }

    private static CommandResponse listRows(Context context, ParseResult args) throws FrameworkException {
        DbConnection db = context.dbConnection();
        TableDescriptor<?> table = table(db, args.matchedOptionValue("--table", ""));
        List<RowId> ids = db.rowIds(table.tableName());
        if (ids.isEmpty()) {
            return CommandResponse.of("No entries in table " + table.tableName() + ".");
        }
        TextTable grid = new TextTable(table.header());
        for (RowId id : ids) {
            grid.row(table.displayRow(db, id));
        }
        return CommandResponse.of(grid.render());
    }

    private static CommandResponse db(Context context, ParseResult args) throws FrameworkException {
        ParseResult sub = args.subcommand();
        if (sub == null) {
            throw new UnknownCommandException("subcommand not recognized");
        }
        DbConnection db = context.dbConnection();
        switch (sub.commandSpec().name()) {
            case "info":
                return CommandResponse.of(infoText(db));
            case "erase":
                db.deleteDatabase();
                return CommandResponse.empty();
            case "backup":
                Path target = Path.of(sub.matchedOptionValue("--out-file", ""));
                db.backup(target);
                return CommandResponse.of("Backed up database to " + target.toAbsolutePath() + ".");
            case "restore":
                Path source = Path.of(sub.matchedOptionValue("--file", ""));
                db.restore(source);
                return CommandResponse.of("Restored database from " + source.toAbsolutePath() + ".");
            default:
                throw new UnknownCommandException("subcommand not recognized: " + sub.commandSpec().name());
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    static String infoText(DbConnection db) {
        if (!db.isOpen()) {
            return "No database connection open.";
        }
        return "Database connection open.\n" + db.dbPath()
                .map(path -> "Database path: \"" + path + "\"")
                .orElse("No database path (in-memory connection)");
    }

    static TableDescriptor<?> table(DbConnection db, String name) throws InvalidArgumentsException {
        return db.table(name).orElseThrow(() -> new InvalidArgumentsException("table does not exist: " + name));
    }

    static FieldInfo field(TableDescriptor<?> table, String column) throws InvalidArgumentsException {
        for (FieldInfo field : table.fields()) {
            if (field.column().equals(column)) {
                return field;
            }
        }
        throw new InvalidArgumentsException("table " + table.tableName() + " has no field " + column
                + " (fields: " + String.join(", ", table.columnNames()) + ")");
    }
}
