package de.bsommerfeld.tassist.core.db;

import de.bsommerfeld.tassist.core.db.TestRows.Booking;
import de.bsommerfeld.tassist.core.db.TestRows.Member;
import de.bsommerfeld.tassist.core.db.TestRows.Person;
import de.bsommerfeld.tassist.core.error.DatabaseException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TableDescriptorTest {

    private DbConnection db;
    private TableDescriptor<Person> persons;
    private TableDescriptor<Booking> bookings;

    @BeforeEach
    void setUp() throws Exception {
        persons = TestRows.persons();
        bookings = TestRows.bookings();
        db = DbConnection.openInMemory(List.of(persons, bookings));
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    // -- Schema --

    @Test
    void columnNames_shouldUseLowerUnderscore() {
        assertEquals(List.of("name", "age", "company_name"), persons.columnNames());
        assertEquals(List.of("ID", "name", "age", "company_name"), persons.header());
    }

    @Test
    void setup_shouldCreateTypedColumns() throws Exception {
        List<String> columns = new ArrayList<>();
        try (Connection raw = DriverManager.getConnection("jdbc:sqlite::memory:");
                Statement stmt = raw.createStatement()) {
            bookings.setup(raw);
            bookings.setup(raw);
            try (ResultSet rs = stmt.executeQuery("PRAGMA table_info(booking)")) {
                while (rs.next()) {
                    columns.add(rs.getString("name") + " " + rs.getString("type"));
                }
            }
        }

        assertEquals(List.of("id INTEGER", "date TEXT", "person INTEGER", "invoice INTEGER",
                "items TEXT", "note TEXT"), columns);
    }

    @Test
    void of_shouldRejectUnsupportedComponentType() {
        assertThrows(IllegalArgumentException.class,
                () -> TableDescriptor.of("bad", TestRows.Unsupported.class));
    }

    @Test
    void of_shouldRejectInvalidTableName() {
        assertThrows(IllegalArgumentException.class, () -> TableDescriptor.of("drop table", Person.class));
    }

    @Test
    void rowMapper_shouldBeBuiltOncePerType() {
        assertSame(RowMapper.of(Person.class), RowMapper.of(Person.class));
    }

    // -- Loading --

    @Test
    void insert_shouldRoundTripRecord() throws Exception {
        Person jane = new Person("Jane", 31, "Gym Inc");

        RowId id = persons.insert(db, jane);

        assertEquals(jane, persons.load(db, id));
    }

    @Test
    void load_shouldFailOnNullField() throws Exception {
        RowId id = db.newRow("person");

        assertThrows(DatabaseException.class, () -> persons.load(db, id));
    }

    @Test
    void load_shouldFailOnMissingRow() {
        assertThrows(DatabaseException.class, () -> persons.load(db, RowId.of(3)));
    }

    @Test
    void load_shouldTreatNullOptionalsAndListsAsEmpty() throws Exception {
        RowId id = db.newRow("booking");
        db.setField("booking", id, "date", LocalDate.of(2024, 3, 1));
        db.setField("booking", id, "person", RowId.of(1));

        Booking booking = bookings.load(db, id);

        assertEquals(LocalDate.of(2024, 3, 1), booking.date());
        assertEquals(Optional.empty(), booking.invoice());
        assertEquals(List.of(), booking.items());
        assertEquals(Optional.empty(), booking.note());
    }

    @Test
    void load_shouldTreatUnparsableOptionalAsEmpty() throws Exception {
        RowId id = db.newRow("booking");
        db.setField("booking", id, "date", "2024-03-01");
        db.setField("booking", id, "person", 1);
        db.setField("booking", id, "invoice", "not a number");

        assertEquals(Optional.empty(), bookings.load(db, id).invoice());
    }

    @Test
    void load_shouldFailOnNonNumericListSegment() throws Exception {
        RowId id = db.newRow("booking");
        db.setField("booking", id, "date", "2024-03-01");
        db.setField("booking", id, "person", 1);
        db.setField("booking", id, "items", "1,x,3");

        assertThrows(DatabaseException.class, () -> bookings.load(db, id));
    }

    @Test
    void store_shouldWriteEveryComponent() throws Exception {
        Booking booking = new Booking(LocalDate.of(2024, 5, 6), RowId.of(2),
                Optional.of(RowId.of(9)), List.of(RowId.of(4), RowId.of(5)), Optional.of("late"));

        RowId id = bookings.insert(db, booking);

        assertEquals("4,5", db.getField("booking", id, "items", String.class));
        assertEquals("2024-05-06", db.getField("booking", id, "date", String.class));
        assertEquals(booking, bookings.load(db, id));
    }

    // -- Display --

    @Test
    void displayRow_shouldShowErrForUnloadableRow() throws Exception {
        RowId id = db.newRow("person");

        assertEquals(List.of("1", "Err", "", ""), persons.displayRow(db, id));
    }

    @Test
    void displayRow_shouldShowErrForRowRejectedByRecordConstructor() throws Exception {
        TableDescriptor<Member> members = TestRows.members();
        DbConnection memberDb = DbConnection.openInMemory(List.of(members));
        RowId id = memberDb.newRow("member");
        memberDb.setField("member", id, "name", " ");

        DatabaseException e = assertThrows(DatabaseException.class, () -> members.load(memberDb, id));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertEquals(List.of("1", "Err"), members.displayRow(memberDb, id));
        memberDb.close();
    }

    @Test
    void displayRow_shouldResolveDisplayTableReference() throws Exception {
        RowId jane = persons.insert(db, new Person("Jane", 31, "Gym Inc"));
        RowId id = bookings.insert(db, new Booking(LocalDate.of(2024, 1, 2), jane,
                Optional.empty(), List.of(RowId.of(7), RowId.of(8)), Optional.of("note")));

        assertEquals(List.of(id.toString(), "2024-01-02", "Jane", "", "7, 8", "note"),
                bookings.displayRow(db, id));
    }

    @Test
    void displayRow_shouldFallBackToIdForDanglingReference() throws Exception {
        RowId id = bookings.insert(db, new Booking(LocalDate.of(2024, 1, 2), RowId.of(42),
                Optional.empty(), List.of(), Optional.empty()));

        assertEquals("42", bookings.displayRow(db, id).get(2));
    }
}
