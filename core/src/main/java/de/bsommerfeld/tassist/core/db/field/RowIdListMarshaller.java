package de.bsommerfeld.tassist.core.db.field;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.DatabaseException;
import de.bsommerfeld.tassist.core.error.FrameworkException;

import java.util.List;

/**
 * Stores an ordered list of row references as comma-joined text, e.g.
 * {@code "3,7,12"}.
 *
 * <p>
 * NULL and empty text decode to an empty list. Blank segments ({@code "3,,7"})
 * are skipped; any other non-numeric segment fails the read.
 */
public final class RowIdListMarshaller implements FieldMarshaller<List<RowId>> {

    private static final Splitter SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Joiner JOINER = Joiner.on(',');

    @Override
    public TypeToken<List<RowId>> javaType() {
        return new TypeToken<List<RowId>>() {
        };
    }

    @Override
    public String sqlType() {
        return "TEXT";
    }

    @Override
    public List<RowId> read(DbConnection db, String table, RowId row, String column) throws FrameworkException {
        Object raw = db.getRawField(table, row, column);
        if (raw == null) {
            return ImmutableList.of();
        }
        // a single id written to a TEXT column may come back as a number
        if (raw instanceof Number number) {
            return ImmutableList.of(RowId.of(number.longValue()));
        }
        return decode(raw.toString(), table + "." + column + " of row " + row);
    }

    static List<RowId> decode(String text, String where) throws DatabaseException {
        ImmutableList.Builder<RowId> ids = ImmutableList.builder();
        for (String segment : SPLITTER.split(text)) {
            try {
                ids.add(RowId.of(Long.parseLong(segment)));
            } catch (NumberFormatException e) {
                throw new DatabaseException(where + " holds a non-numeric row id '" + segment + "'", e);
            }
        }
        return ids.build();
    }

    @Override
    public Object toSql(List<RowId> value) {
        return JOINER.join(value);
    }

    @Override
    public String display(List<RowId> value, DisplayContext context) {
        StringBuilder sb = new StringBuilder();
        for (RowId id : value) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(context.displayRowId(id));
        }
        return sb.toString();
    }
}
