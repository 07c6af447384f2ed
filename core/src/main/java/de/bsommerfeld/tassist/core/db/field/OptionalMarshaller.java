package de.bsommerfeld.tassist.core.db.field;

import com.google.common.reflect.TypeParameter;
import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.DatabaseException;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Wraps the marshaller of {@code T} for an {@code Optional<T>} field.
 *
 * <p>
 * A NULL column, or one whose value the inner marshaller rejects, reads as
 * {@link Optional#empty()}. A missing row is still an error.
 */
public final class OptionalMarshaller<T> implements FieldMarshaller<Optional<T>> {

    private static final Logger LOG = LoggerFactory.getLogger(OptionalMarshaller.class);

    private final FieldMarshaller<T> inner;

    public OptionalMarshaller(FieldMarshaller<T> inner) {
        this.inner = inner;
    }

    @Override
    public TypeToken<Optional<T>> javaType() {
        return new TypeToken<Optional<T>>() {
        }.where(new TypeParameter<T>() {
        }, inner.javaType());
    }

    @Override
    public String sqlType() {
        return inner.sqlType();
    }

    @Override
    public Optional<T> read(DbConnection db, String table, RowId row, String column) throws FrameworkException {
        if (db.getRawField(table, row, column) == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(inner.read(db, table, row, column));
        } catch (DatabaseException e) {
            LOG.trace("Treating unreadable {}.{} of row {} as absent: {}", table, column, row, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Object toSql(Optional<T> value) {
        return value.map(inner::toSql).orElse(null);
    }

    @Override
    public String display(Optional<T> value, DisplayContext context) {
        return value.map(v -> inner.display(v, context)).orElse("");
    }
}
