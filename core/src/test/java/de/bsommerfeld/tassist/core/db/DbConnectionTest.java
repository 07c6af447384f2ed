package de.bsommerfeld.tassist.core.db;

import de.bsommerfeld.tassist.core.error.DatabaseException;
import de.bsommerfeld.tassist.core.error.FileException;
import de.bsommerfeld.tassist.core.error.NoConnectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests DbConnection against real SQLite databases, in memory and in a
 * temporary directory.
 */
class DbConnectionTest {

    @TempDir
    Path tempDir;

    private DbConnection db;

    @BeforeEach
    void setUp() throws Exception {
        db = DbConnection.openInMemory(List.of(TestRows.persons()));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (db.isOpen()) {
            db.deleteDatabase();
        }
    }

    // -- Rows --

    @Test
    void newRow_shouldStartAtOneInFreshTable() throws Exception {
        RowId id = db.newRow("person");

        assertEquals(RowId.of(1), id);
        assertEquals(List.of(id), db.rowIds("person"));
    }

    @Test
    void newRow_shouldNeverReuseIdsOfRemovedRows() throws Exception {
        RowId first = db.newRow("person");
        RowId second = db.newRow("person");
        db.removeRow("person", second);

        RowId third = db.newRow("person");

        assertTrue(third.compareTo(second) > 0);
        assertEquals(List.of(first, third), db.rowIds("person"));
    }

    @Test
    void newRow_shouldNotReuseIdsAfterTableWasEmptied() throws Exception {
        db.newRow("person");
        RowId last = db.newRow("person");
        for (RowId id : db.rowIds("person")) {
            db.removeRow("person", id);
        }

        RowId next = db.newRow("person");

        assertEquals(RowId.of(last.value() + 1), next);
    }

    @Test
    void newRow_shouldFailForUnknownTable() {
        assertThrows(DatabaseException.class, () -> db.newRow("nope"));
    }

    @Test
    void rowIds_shouldBeInInsertionOrder() throws Exception {
        RowId a = db.newRow("person");
        RowId b = db.newRow("person");
        RowId c = db.newRow("person");

        assertEquals(List.of(a, b, c), db.rowIds("person"));
    }

    @Test
    void removeRow_shouldDropExistingRow() throws Exception {
        RowId id = db.newRow("person");

        db.removeRow("person", id);

        assertTrue(db.rowIds("person").isEmpty());
    }

    @Test
    void removeRow_shouldSucceedForMissingRow() throws Exception {
        RowId id = db.newRow("person");

        assertDoesNotThrow(() -> db.removeRow("person", RowId.of(99)));
        assertEquals(List.of(id), db.rowIds("person"));
    }

    // -- Fields --

    @Test
    void setField_shouldRoundTripString() throws Exception {
        RowId id = db.newRow("person");

        db.setField("person", id, "name", "Jane Doe");

        assertEquals("Jane Doe", db.getField("person", id, "name", String.class));
    }

    @Test
    void setField_shouldRoundTripIntegers() throws Exception {
        RowId id = db.newRow("person");

        db.setField("person", id, "age", 42);

        assertEquals(42, db.getField("person", id, "age", Integer.class));
        assertEquals(42L, db.getField("person", id, "age", Long.class));
    }

    @Test
    void setField_shouldRoundTripRowId() throws Exception {
        RowId id = db.newRow("person");

        db.setField("person", id, "age", RowId.of(7));

        assertEquals(RowId.of(7), db.getField("person", id, "age", RowId.class));
    }

    @Test
    void getField_shouldRejectMistypedColumn() throws Exception {
        RowId id = db.newRow("person");
        db.setField("person", id, "age", 42);

        assertThrows(DatabaseException.class, () -> db.getField("person", id, "age", String.class));
    }

    @Test
    void getField_shouldRejectNullColumn() throws Exception {
        RowId id = db.newRow("person");

        assertThrows(DatabaseException.class, () -> db.getField("person", id, "name", String.class));
    }

    @Test
    void getField_shouldRejectMissingRow() {
        assertThrows(DatabaseException.class, () -> db.getField("person", RowId.of(5), "name", String.class));
    }

    @Test
    void getField_shouldRejectUnknownColumn() throws Exception {
        RowId id = db.newRow("person");

        assertThrows(DatabaseException.class, () -> db.getField("person", id, "salary", String.class));
    }

    @Test
    void getRawField_shouldReturnNullForNullColumn() throws Exception {
        RowId id = db.newRow("person");

        assertNull(db.getRawField("person", id, "company_name"));
    }

    // -- Lifecycle --

    @Test
    void deleteDatabase_shouldCloseInMemoryConnection() throws Exception {
        db.newRow("person");

        db.deleteDatabase();

        assertFalse(db.isOpen());
        assertThrows(NoConnectionException.class, () -> db.rowIds("person"));
        assertThrows(NoConnectionException.class, () -> db.newRow("person"));
        assertThrows(NoConnectionException.class, db::deleteDatabase);
    }

    @Test
    void openFile_shouldCreateParentDirectoriesAndDeleteFile() throws Exception {
        Path file = tempDir.resolve("nested").resolve("dir").resolve("data.db");
        DbConnection fileDb = DbConnection.openFile(file, List.of(TestRows.persons()));

        assertTrue(Files.exists(file));
        assertEquals(file.toAbsolutePath(), fileDb.dbPath().orElseThrow());

        fileDb.deleteDatabase();

        assertFalse(fileDb.isOpen());
        assertFalse(Files.exists(file));
    }

    @Test
    void openFile_shouldKeepRowsAcrossReopen() throws Exception {
        Path file = tempDir.resolve("data.db");
        DbConnection first = DbConnection.openFile(file, List.of(TestRows.persons()));
        RowId id = first.newRow("person");
        first.setField("person", id, "name", "Kept");
        first.close();

        DbConnection second = DbConnection.openFile(file, List.of(TestRows.persons()));

        assertEquals("Kept", second.getField("person", id, "name", String.class));
        second.deleteDatabase();
    }

    @Test
    void openFile_shouldFailWhenParentIsAFile() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");

        assertThrows(FileException.class,
                () -> DbConnection.openFile(blocker.resolve("data.db"), List.of(TestRows.persons())));
    }

    @Test
    void close_shouldBeIdempotent() throws Exception {
        db.close();
        db.close();

        assertFalse(db.isOpen());
    }

    @Test
    void dbPath_shouldBeEmptyInMemory() {
        assertTrue(db.dbPath().isEmpty());
    }

    @Test
    void table_shouldFindRegisteredDescriptor() {
        assertTrue(db.table("person").isPresent());
        assertTrue(db.table("booking").isEmpty());
        assertEquals(1, db.tables().size());
    }

    @Test
    void backupAndRestore_shouldRoundTripRows() throws Exception {
        RowId id = db.newRow("person");
        db.setField("person", id, "name", "Before");
        Path backup = tempDir.resolve("backup.db");

        db.backup(backup);
        db.setField("person", id, "name", "After");
        db.newRow("person");
        db.restore(backup);

        assertTrue(Files.exists(backup));
        assertEquals(List.of(id), db.rowIds("person"));
        assertEquals("Before", db.getField("person", id, "name", String.class));
    }

    @Test
    void backup_shouldRejectPathWithDoubleQuote() throws Exception {
        db.newRow("person");
        Path quoted = tempDir.resolve("my\"backup.db");

        FileException e = assertThrows(FileException.class, () -> db.backup(quoted));

        assertTrue(e.getMessage().contains("must not contain"), e.getMessage());
        assertFalse(Files.exists(quoted));
        assertTrue(db.isOpen());
    }

    @Test
    void restore_shouldRejectPathWithDoubleQuote() throws Exception {
        Path quoted = Files.createFile(tempDir.resolve("my\"backup.db"));

        FileException e = assertThrows(FileException.class, () -> db.restore(quoted));

        assertTrue(e.getMessage().contains("must not contain"), e.getMessage());
    }

    @Test
    void restore_shouldFailForMissingFile() {
        assertThrows(FileException.class, () -> db.restore(tempDir.resolve("missing.db")));
    }
}
