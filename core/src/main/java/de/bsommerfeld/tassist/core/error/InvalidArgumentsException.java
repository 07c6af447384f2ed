package de.bsommerfeld.tassist.core.error;

/**
 * The command was recognized but its arguments were not: a required option is
 * missing, a value has the wrong type, or the quoting is unbalanced.
 */
public class InvalidArgumentsException extends FrameworkException {

    public InvalidArgumentsException(String message) {
        super(message);
    }

    public InvalidArgumentsException(String message, Throwable cause) {
        super(message, cause);
    }
}
