package de.bsommerfeld.tassist.core.error;

/** A command handler rejected otherwise well-formed input. */
public class CommandException extends FrameworkException {

    public CommandException(String message) {
        super(message);
    }
}
