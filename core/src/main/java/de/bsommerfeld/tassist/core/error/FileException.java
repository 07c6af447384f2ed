package de.bsommerfeld.tassist.core.error;

/** Directory or file creation/deletion failed. */
public class FileException extends FrameworkException {

    public FileException(String message) {
        super(message);
    }

    public FileException(String message, Throwable cause) {
        super(message, cause);
    }
}
