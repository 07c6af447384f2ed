package de.bsommerfeld.tassist.core.error;

/**
 * Thrown when a database operation is attempted before
 * {@link de.bsommerfeld.tassist.core.Context#startup()} or after the database
 * was deleted.
 */
public class NoConnectionException extends FrameworkException {

    public NoConnectionException() {
        super("no active database connection");
    }
}
