package io.fullerstack.connector.core.error;

import java.util.Objects;

/**
 * Exception raised while computing a connector response.
 * <p>
 * Carries the {@link ErrorCategory} that decides how the failure is reported.
 */
public class ConnectorException extends RuntimeException {

    private final ErrorCategory category;

    public ConnectorException(ErrorCategory category, String message) {
        super(message);
        this.category = Objects.requireNonNull(category, "category cannot be null");
    }

    public ConnectorException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category cannot be null");
    }

    public ErrorCategory category() {
        return category;
    }
}
