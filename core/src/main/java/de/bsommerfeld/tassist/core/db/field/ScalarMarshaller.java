package de.bsommerfeld.tassist.core.db.field;

import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.FrameworkException;

/**
 * Marshaller for types the connection converts itself, see
 * {@link DbConnection#getField(String, RowId, String, Class)}.
 */
public final class ScalarMarshaller<T> implements FieldMarshaller<T> {

    public static final ScalarMarshaller<String> STRING = new ScalarMarshaller<>(String.class, "TEXT");
    public static final ScalarMarshaller<Integer> INTEGER = new ScalarMarshaller<>(Integer.class, "INTEGER");
    public static final ScalarMarshaller<Long> LONG = new ScalarMarshaller<>(Long.class, "INTEGER");
    public static final ScalarMarshaller<Double> DOUBLE = new ScalarMarshaller<>(Double.class, "REAL");
    public static final ScalarMarshaller<Boolean> BOOLEAN = new ScalarMarshaller<>(Boolean.class, "INTEGER");

    private final Class<T> type;
    private final String sqlType;

    private ScalarMarshaller(Class<T> type, String sqlType) {
        this.type = type;
        this.sqlType = sqlType;
    }

    @Override
    public TypeToken<T> javaType() {
        return TypeToken.of(type);
    }

    @Override
    public String sqlType() {
        return sqlType;
    }

    @Override
    public T read(DbConnection db, String table, RowId row, String column) throws FrameworkException {
        return db.getField(table, row, column, type);
    }
}
