package io.fullerstack.connector.core.model;

/**
 * Completion status reported with each returned series.
 * <p>
 * Connectors compute the whole requested range in one invocation, so every
 * series they emit is {@link #COMPLETE}.
 */
public enum SeriesStatus {

    COMPLETE("Complete");

    private final String code;

    SeriesStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
