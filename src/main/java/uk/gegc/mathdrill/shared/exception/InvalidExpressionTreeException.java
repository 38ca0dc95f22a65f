package uk.gegc.mathdrill.shared.exception;

/**
 * Exception thrown when a serialized expression tree cannot be restored.
 */
public class InvalidExpressionTreeException extends RuntimeException {

    public InvalidExpressionTreeException(String message) {
        super(message);
    }

    public InvalidExpressionTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
