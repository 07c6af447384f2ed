package de.bsommerfeld.tassist.core.db.field;

import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.FrameworkException;

/**
 * Converts one record field type between its Java form and a SQLite column.
 *
 * <p>
 * Every component type of a mapped record needs a marshaller registered in the
 * {@link MarshallerRegistry} the record's mapper was built with. Composite
 * types such as {@code List<RowId>} define their own encoding and must report
 * malformed input as an error instead of throwing unchecked exceptions.
 *
 * @param <T> the Java type of the field
 */
public interface FieldMarshaller<T> {

    /** The Java type this marshaller handles, used as the registry key. */
    TypeToken<T> javaType();

    /** Column type used in {@code CREATE TABLE}, e.g. {@code TEXT}. */
    String sqlType();

    /**
     * Reads the column of one row and converts it.
     *
     * @throws FrameworkException if the row is absent or the stored value
     *                            cannot be converted
     */
    T read(DbConnection db, String table, RowId row, String column) throws FrameworkException;

    /** The value handed to JDBC when the field is written. */
    default Object toSql(T value) {
        return value;
    }

    /** Text shown for the value in listings. */
    default String display(T value, DisplayContext context) {
        return String.valueOf(value);
    }
}
