package uk.gegc.educore.shared.exception;

/**
 * Exception thrown when the external grading model fails or answers with
 * something that cannot be interpreted as a grade.
 */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
