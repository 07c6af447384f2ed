package de.bsommerfeld.tassist.db;

import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.FileException;
import de.bsommerfeld.tassist.core.error.InvalidArgumentsException;
import de.bsommerfeld.tassist.core.error.NoConnectionException;
import de.bsommerfeld.tassist.core.error.UnknownCommandException;
import de.bsommerfeld.tassist.tui.NewTabKinds;
import de.bsommerfeld.tassist.tui.TabKind;
import de.bsommerfeld.tassist.tui.TuiPlugin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DbCommandsPluginTest {

    @TempDir
    Path tempDir;

    private Context context;
    private DbConnection db;

    @BeforeEach
    void setUp() throws Exception {
        context = TestTables.startedContext(new DbCommandsPlugin());
        db = context.dbConnection();
    }

    private String run(String command) throws Exception {
        return context.execute(command).text().orElse("");
    }

    // -- new / remove --

    @Test
    void new_shouldReportInsertedRow() throws Exception {
        assertEquals("Inserted new row (id: 1) in table trainer.", run("new --table=trainer"));
        assertEquals("Inserted new row (id: 2) in table trainer.", run("new --table trainer"));
    }

    @Test
    void new_shouldRejectUnknownTable() {
        InvalidArgumentsException e = assertThrows(InvalidArgumentsException.class,
                () -> run("new --table=invoice"));

        assertTrue(e.getMessage().contains("invoice"));
    }

    @Test
    void new_shouldRequireTableOption() {
        assertThrows(InvalidArgumentsException.class, () -> run("new"));
    }

    @Test
    void remove_shouldDeleteRowByIdUnderBothNames() throws Exception {
        run("new --table=trainer");
        run("new --table=trainer");
        run("new --table=trainer");

        assertTrue(context.execute("remove --table=trainer --row-id=1").text().isEmpty());
        run("rm --table=trainer --row-id=3");

        assertEquals(List.of(RowId.of(2)), db.rowIds("trainer"));
    }

    @Test
    void new_shouldNotHandOutIdOfRemovedLastRow() throws Exception {
        run("new --table=trainer");
        run("new --table=trainer");
        run("rm --table=trainer --row-id=2");

        assertEquals("Inserted new row (id: 3) in table trainer.", run("new --table=trainer"));
    }

    @Test
    void remove_shouldRejectNonNumericRowId() {
        assertThrows(InvalidArgumentsException.class, () -> run("rm --table=trainer --row-id=one"));
    }

    // -- set --

    @Test
    void set_shouldStoreQuotedText() throws Exception {
        run("new --table=trainer");

        run("set --table trainer --row-id 1 --field name --value \"Jane Doe\"");

        assertEquals("Jane Doe", db.getField("trainer", RowId.of(1), "name", String.class));
    }

    @Test
    void set_shouldParseValueByFieldType() throws Exception {
        run("new --table=visit");

        run("set --table visit --row-id 1 --field date --value 2024-05-01");
        run("set --table visit --row-id 1 --field minutes --value 45");
        run("set --table visit --row-id 1 --field paid --value true");
        run("set --table visit --row-id 1 --field exercises --value 3,4");

        assertEquals("2024-05-01", db.getField("visit", RowId.of(1), "date", String.class));
        assertEquals(45L, db.getField("visit", RowId.of(1), "minutes", Long.class));
        assertEquals(1L, db.getField("visit", RowId.of(1), "paid", Long.class));
        assertEquals("3,4", db.getField("visit", RowId.of(1), "exercises", String.class));
    }

    @Test
    void set_shouldRejectUnparsableValue() throws Exception {
        run("new --table=visit");

        assertThrows(InvalidArgumentsException.class,
                () -> run("set --table visit --row-id 1 --field date --value tomorrow"));
        assertThrows(InvalidArgumentsException.class,
                () -> run("set --table visit --row-id 1 --field paid --value yes"));
    }

    @Test
    void set_shouldRejectUnknownField() throws Exception {
        run("new --table=trainer");

        InvalidArgumentsException e = assertThrows(InvalidArgumentsException.class,
                () -> run("set --table trainer --row-id 1 --field nickname --value x"));

        assertTrue(e.getMessage().contains("company_name"));
    }

    // -- list --

    @Test
    void list_shouldReportEmptyTable() throws Exception {
        assertEquals("No entries in table trainer.", run("list --table=trainer"));
    }

    @Test
    void list_shouldShowErrForRowWithMissingValues() throws Exception {
        run("new --table=trainer");

        String expected = String.join("\n",
                "+----+------+--------------+---------+-------+-------+",
                "| ID | name | company_name | address | email | phone |",
                "+----+------+--------------+---------+-------+-------+",
                "| 1  | Err  |              |         |       |       |",
                "+----+------+--------------+---------+-------+-------+");
        assertEquals(expected, run("list --table=trainer"));
    }

    @Test
    void list_shouldShowStoredValuesAndResolveReferences() throws Exception {
        run("new --table=trainer");
        for (String field : List.of("name", "company_name", "address", "email", "phone")) {
            run("set --table trainer --row-id 1 --field " + field + " --value " + field.charAt(0));
        }
        run("new --table=visit");
        run("set --table visit --row-id 1 --field date --value 2024-05-01");
        run("set --table visit --row-id 1 --field trainer --value 1");
        run("set --table visit --row-id 1 --field minutes --value 30");
        run("set --table visit --row-id 1 --field paid --value false");

        String trainers = run("ls --table=trainer");
        String visits = run("ls --table=visit");

        assertTrue(trainers.contains("| 1  | n    | c            | a       | e     | p     |"), trainers);
        assertTrue(visits.contains("| 1  | 2024-05-01 | n       |"), visits);
    }

    // -- db --

    @Test
    void dbInfo_shouldDescribeInMemoryConnection() throws Exception {
        assertEquals("Database connection open.\nNo database path (in-memory connection)", run("db info"));
    }

    @Test
    void dbInfo_shouldShowFilePath() throws Exception {
        Path file = tempDir.resolve("data.db");
        Context fileContext = new Context();
        fileContext.dbPath(file);
        fileContext.addPlugin(new DbCommandsPlugin());
        fileContext.startup();

        assertEquals("Database connection open.\nDatabase path: \"" + file + "\"",
                fileContext.execute("db info").text().orElseThrow());
        fileContext.dbConnection().close();
    }

    @Test
    void dbErase_shouldCloseConnection() throws Exception {
        run("new --table=trainer");

        run("db erase");

        assertFalse(db.isOpen());
        assertEquals("No database connection open.", run("db info"));
        assertThrows(NoConnectionException.class, () -> run("new --table=trainer"));
    }

    @Test
    void dbErase_shouldDeleteFile() throws Exception {
        Path file = tempDir.resolve("erase.db");
        Context fileContext = new Context();
        fileContext.dbPath(file);
        fileContext.addPlugin(new DbCommandsPlugin());
        fileContext.startup();
        assertTrue(Files.exists(file));

        fileContext.execute("db erase");

        assertFalse(Files.exists(file));
    }

    @Test
    void db_shouldRequireSubcommand() {
        assertThrows(UnknownCommandException.class, () -> run("db"));
        assertThrows(UnknownCommandException.class, () -> run("db vacuum"));
    }

    @Test
    void dbBackupAndRestore_shouldRoundTripRows() throws Exception {
        run("new --table=trainer");
        run("new --table=trainer");
        Path backup = tempDir.resolve("backup.db");

        assertTrue(run("db backup --out-file " + backup).startsWith("Backed up database to"));
        run("rm --table=trainer --row-id=1");
        run("db restore --file " + backup);

        assertEquals(List.of(RowId.of(1), RowId.of(2)), db.rowIds("trainer"));
    }

    @Test
    void dbRestore_shouldFailForMissingFile() {
        assertThrows(FileException.class, () -> run("db restore --file " + tempDir.resolve("missing.db")));
    }

    // -- Tabs --

    @Test
    void build_shouldOfferTabsWhenTerminalUiIsPresent() throws Exception {
        Context withTui = TestTables.startedContext(new TuiPlugin(), new DbCommandsPlugin());

        List<String> names = withTui.requireResource(NewTabKinds.class).kinds().stream()
                .map(TabKind::name)
                .collect(Collectors.toList());

        assertEquals(List.of("Database Info", "Edit Table"), names);
    }

    @Test
    void build_shouldSkipTabsWithoutTerminalUi() {
        assertFalse(context.hasResource(NewTabKinds.class));
        assertTrue(context.commandNames().containsAll(List.of("new", "remove", "set", "list", "db")));
    }
}
