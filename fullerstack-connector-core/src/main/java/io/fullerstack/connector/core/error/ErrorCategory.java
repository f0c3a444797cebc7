package io.fullerstack.connector.core.error;

/**
 * Failure categories reported back to the console.
 * <p>
 * The console must not retry {@link #VALIDATION} failures since the same arguments
 * will fail again; {@link #INTERNAL_ERROR} failures may succeed on a later attempt.
 *
 * @author Fullerstack
 */
public enum ErrorCategory {

    VALIDATION("Validation"),
    INTERNAL_ERROR("InternalError");

    private final String code;

    ErrorCategory(String code) {
        this.code = code;
    }

    /**
     * Wire code carried in the failure response.
     */
    public String code() {
        return code;
    }

    public boolean isRetryable() {
        return this == INTERNAL_ERROR;
    }
}
