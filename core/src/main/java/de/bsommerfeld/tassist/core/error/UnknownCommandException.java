package de.bsommerfeld.tassist.core.error;

/** The command string did not match any registered command or subcommand. */
public class UnknownCommandException extends FrameworkException {

    public UnknownCommandException(String message) {
        super(message);
    }

    public UnknownCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
