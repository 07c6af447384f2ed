package de.bsommerfeld.tassist.core.db.field;

import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.DisplayTable;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * What a marshaller may consult while rendering a value: the connection and the
 * {@link DisplayTable} reference declared on the field, if any.
 */
public record DisplayContext(DbConnection db, Optional<DisplayTable> reference) {

    private static final Logger LOG = LoggerFactory.getLogger(DisplayContext.class);

    public static DisplayContext plain(DbConnection db) {
        return new DisplayContext(db, Optional.empty());
    }

    /**
     * Renders a row id through the declared reference. Falls back to the bare
     * id when there is no reference or the referenced row cannot be read.
     */
    public String displayRowId(RowId id) {
        if (reference.isEmpty()) {
            return id.toString();
        }
        DisplayTable ref = reference.get();
        try {
            Object value = db.getRawField(ref.table(), id, ref.column());
            return value == null ? "" : value.toString();
        } catch (FrameworkException e) {
            LOG.debug("Cannot resolve {}.{} for row {}: {}", ref.table(), ref.column(), id, e.getMessage());
            return id.toString();
        }
    }
}
