package de.bsommerfeld.tassist.db;

import de.bsommerfeld.tassist.core.db.FieldInfo;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.InvalidArgumentsException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FieldParserTest {

    private static FieldInfo field(String column) throws InvalidArgumentsException {
        return DbCommandsPlugin.field(TestTables.VISIT, column);
    }

    @Test
    void parse_shouldConvertByDeclaredType() throws Exception {
        assertEquals(LocalDate.of(2024, 5, 1), FieldParser.parse(field("date"), "2024-05-01"));
        assertEquals(RowId.of(7), FieldParser.parse(field("trainer"), " 7 "));
        assertEquals(90, FieldParser.parse(field("minutes"), "90"));
        assertEquals(Boolean.TRUE, FieldParser.parse(field("paid"), "TRUE"));
    }

    @Test
    void parse_shouldKeepTextVerbatim() throws Exception {
        FieldInfo name = DbCommandsPlugin.field(TestTables.TRAINER, "name");

        assertEquals("  Jane ", FieldParser.parse(name, "  Jane "));
    }

    @Test
    void parse_shouldTreatBlankAsEmptyOptional() throws Exception {
        assertEquals(Optional.empty(), FieldParser.parse(field("invoice"), ""));
        assertEquals(Optional.of(RowId.of(3)), FieldParser.parse(field("invoice"), "3"));
    }

    @Test
    void parse_shouldSplitRowIdLists() throws Exception {
        assertEquals(List.of(RowId.of(1), RowId.of(5)), FieldParser.parse(field("exercises"), "1, 5,"));
        assertEquals(List.of(), FieldParser.parse(field("exercises"), ""));
    }

    @Test
    void parse_shouldRejectMalformedInput() {
        InvalidArgumentsException e = assertThrows(InvalidArgumentsException.class,
                () -> FieldParser.parse(field("minutes"), "ninety"));

        assertTrue(e.getMessage().contains("minutes"));
        assertThrows(InvalidArgumentsException.class, () -> FieldParser.parse(field("paid"), "1"));
        assertThrows(InvalidArgumentsException.class, () -> FieldParser.parse(field("exercises"), "1,x"));
    }

    @Test
    void isEditable_shouldAcceptEveryMappedVisitField() {
        for (FieldInfo info : TestTables.VISIT.fields()) {
            assertTrue(FieldParser.isEditable(info), info.column());
        }
    }
}
