package de.bsommerfeld.tassist.core.error;

/**
 * Any failure reported by the backing store: malformed SQL, a missing table or
 * row, or a column value that cannot be converted to the requested type.
 */
public class DatabaseException extends FrameworkException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
