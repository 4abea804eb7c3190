package uk.gegc.educore.shared.exception;

/**
 * Thrown when a request is well-formed but clashes with the current state of a
 * resource: quota exhausted, attempt already submitted, duplicate name.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
