package de.bsommerfeld.tassist.core.db.field;

import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.DatabaseException;
import de.bsommerfeld.tassist.core.error.FrameworkException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/** Stores a date as ISO-8601 text ({@code 2024-03-01}), which sorts correctly. */
public final class LocalDateMarshaller implements FieldMarshaller<LocalDate> {

    @Override
    public TypeToken<LocalDate> javaType() {
        return TypeToken.of(LocalDate.class);
    }

    @Override
    public String sqlType() {
        return "TEXT";
    }

    @Override
    public LocalDate read(DbConnection db, String table, RowId row, String column) throws FrameworkException {
        String text = db.getField(table, row, column, String.class);
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new DatabaseException(table + "." + column + " of row " + row + " is not a date: '" + text + "'", e);
        }
    }

    @Override
    public Object toSql(LocalDate value) {
        return value.toString();
    }
}
