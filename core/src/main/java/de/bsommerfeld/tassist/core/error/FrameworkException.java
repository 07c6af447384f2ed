package de.bsommerfeld.tassist.core.error;

/**
 * Base type of every failure surfaced by the extension runtime.
 *
 * <p>
 * The runtime never recovers locally: an exception thrown by a connection
 * operation, a marshaller or a command handler travels unchanged up to
 * {@link de.bsommerfeld.tassist.core.Context#execute(String)} and from there to
 * the caller, which decides how to present it. No operation is retried.
 */
public class FrameworkException extends Exception {

    public FrameworkException(String message) {
        super(message);
    }

    public FrameworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
