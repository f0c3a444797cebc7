package io.fullerstack.connector.core.error;

/**
 * Exception thrown when caller-supplied arguments are malformed or out of range.
 */
public class ValidationException extends ConnectorException {

    public ValidationException(String message) {
        super(ErrorCategory.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCategory.VALIDATION, message, cause);
    }
}
