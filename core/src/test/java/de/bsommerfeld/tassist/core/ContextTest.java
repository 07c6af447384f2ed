package de.bsommerfeld.tassist.core;

import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.db.TableDescriptor;
import de.bsommerfeld.tassist.core.error.MissingResourceException;
import de.bsommerfeld.tassist.core.error.NoConnectionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextTest {

    @TempDir
    Path tempDir;

    record Note(String text) {
    }

    record Marker(String owner) {
    }

    /** Registers the note table and a {@code new} command creating rows in it. */
    static final class NotesPlugin implements Plugin {
        @Override
        public void build(Context context) {
            context.addTable(TableDescriptor.of("note", Note.class));
            CommandSpec spec = CommandSpec.create().name("new");
            spec.addOption(OptionSpec.builder("--table").type(String.class).required(true).build());
            context.addCommand(spec, (ctx, args) -> {
                String table = args.matchedOptionValue("--table", "");
                RowId id = ctx.dbConnection().newRow(table);
                return CommandResponse.of("Inserted new row (id: " + id + ") in table " + table + ".");
            });
        }
    }

    @Test
    void execute_shouldRouteToPluginCommand() throws Exception {
        Context context = new Context();
        context.inMemoryDb(true);
        context.addPlugin(new NotesPlugin());
        context.startup();

        CommandResponse response = context.execute("new --table=note");

        assertEquals("Inserted new row (id: 1) in table note.", response.text().orElseThrow());
        assertEquals(List.of(RowId.of(1)), context.dbConnection().rowIds("note"));
    }

    @Test
    void addPlugin_shouldBuildInRegistrationOrder() throws Exception {
        List<String> order = new ArrayList<>();
        Context context = new Context();

        context.addPlugin(ctx -> order.add("first"))
                .addPlugin(ctx -> order.add("second"));

        assertEquals(List.of("first", "second"), order);
        assertEquals(2, context.pluginCount());
    }

    @Test
    void addPlugin_shouldSeeResourcesOfEarlierPlugins() throws Exception {
        Context context = new Context();
        context.addPlugin(ctx -> ctx.addResource(new Marker("first")));

        List<String> seen = new ArrayList<>();
        context.addPlugin(ctx -> seen.add(ctx.requireResource(Marker.class).owner()));

        assertEquals(List.of("first"), seen);
    }

    @Test
    void requireResource_shouldFailLoudlyWhenAbsent() {
        Context context = new Context();

        MissingResourceException e = assertThrows(MissingResourceException.class,
                () -> context.addPlugin(ctx -> ctx.requireResource(Marker.class)));
        assertEquals(Marker.class, e.getResourceType());
    }

    @Test
    void addTable_shouldRejectDuplicateNames() {
        Context context = new Context();
        context.addTable(TableDescriptor.of("note", Note.class));

        assertThrows(IllegalArgumentException.class,
                () -> context.addTable(TableDescriptor.of("note", Marker.class)));
    }

    @Test
    void dbConnection_shouldFailBeforeStartup() {
        assertThrows(NoConnectionException.class, () -> new Context().dbConnection());
    }

    @Test
    void startup_shouldRegisterConnectionResource() throws Exception {
        Context context = new Context();
        context.inMemoryDb(true);
        context.startup();

        assertTrue(context.hasResource(DbConnection.class));
        assertTrue(context.dbConnection().isOpen());
    }

    @Test
    void startup_shouldRejectSecondStartWhileOpen() throws Exception {
        Context context = new Context();
        context.inMemoryDb(true);
        context.startup();

        assertThrows(IllegalStateException.class, context::startup);
    }

    @Test
    void startup_shouldReopenAfterDatabaseWasDeleted() throws Exception {
        Context context = new Context();
        context.inMemoryDb(true);
        context.addPlugin(new NotesPlugin());
        context.startup();
        context.execute("new --table=note");
        context.dbConnection().deleteDatabase();

        context.startup();

        assertTrue(context.dbConnection().rowIds("note").isEmpty());
    }

    @Test
    void startup_shouldUseConfiguredFile() throws Exception {
        Path file = tempDir.resolve("data").resolve("data.db");
        Context context = new Context();
        context.dbPath(file);
        context.addPlugin(new NotesPlugin());
        context.startup();

        assertTrue(Files.exists(file));
        assertEquals(file.toAbsolutePath(), context.dbConnection().dbPath().orElseThrow());
        context.dbConnection().deleteDatabase();
    }

    @Test
    void defaultDbPath_shouldLiveInAppDataDir() {
        Path path = Context.defaultDbPath();

        assertTrue(path.isAbsolute());
        assertTrue(path.endsWith(Path.of("data", "data.db")));
        assertTrue(path.toString().contains(Context.APP_NAME));
    }
}
