package de.bsommerfeld.tassist.core.db.field;

import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.FrameworkException;

/** Stores a row reference as its numeric id. */
public final class RowIdMarshaller implements FieldMarshaller<RowId> {

    @Override
    public TypeToken<RowId> javaType() {
        return TypeToken.of(RowId.class);
    }

    @Override
    public String sqlType() {
        return "INTEGER";
    }

    @Override
    public RowId read(DbConnection db, String table, RowId row, String column) throws FrameworkException {
        return db.getField(table, row, column, RowId.class);
    }

    @Override
    public Object toSql(RowId value) {
        return value.value();
    }

    @Override
    public String display(RowId value, DisplayContext context) {
        return context.displayRowId(value);
    }
}
