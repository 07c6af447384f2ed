package de.bsommerfeld.tassist.core.db;

import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.db.field.DisplayContext;
import de.bsommerfeld.tassist.core.db.field.FieldMarshaller;
import de.bsommerfeld.tassist.core.error.FrameworkException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Optional;

/**
 * One mapped record component: its column, declared type, marshaller and
 * optional display reference.
 */
public final class FieldInfo {

    private final String column;
    private final TypeToken<?> type;
    private final FieldMarshaller<Object> marshaller;
    private final Optional<DisplayTable> displayTable;
    private final Method accessor;

    @SuppressWarnings("unchecked")
    FieldInfo(String column, TypeToken<?> type, FieldMarshaller<?> marshaller,
            Optional<DisplayTable> displayTable, Method accessor) {
        this.column = column;
        this.type = type;
        this.marshaller = (FieldMarshaller<Object>) marshaller;
        this.displayTable = displayTable;
        this.accessor = accessor;
    }

    /** Column name in lower_underscore form. */
    public String column() {
        return column;
    }

    public TypeToken<?> type() {
        return type;
    }

    public String sqlType() {
        return marshaller.sqlType();
    }

    public Optional<DisplayTable> displayTable() {
        return displayTable;
    }

    Object read(DbConnection db, String table, RowId row) throws FrameworkException {
        return marshaller.read(db, table, row, column);
    }

    Object valueOf(Record record) {
        try {
            return accessor.invoke(record);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("cannot read component " + accessor.getName(), e);
        }
    }

    Object toSql(Object value) {
        return value == null ? null : marshaller.toSql(value);
    }

    String display(Object value, DbConnection db) {
        return marshaller.display(value, new DisplayContext(db, displayTable));
    }

    @Override
    public String toString() {
        return column + " " + sqlType();
    }
}
