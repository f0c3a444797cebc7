package io.fullerstack.connector.cloudwatch.config;

import java.util.Arrays;

/**
 * Connectors a deployment can be configured to serve.
 */
public enum ConnectorType {

    ECHO("echo"),
    MOVING_AVERAGE("moving-average"),
    TIMESHIFT("timeshift"),
    HISTOGRAM("histogram"),
    FILTER("filter"),
    MULTI_REGION("multi-region");

    private final String id;

    ConnectorType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolve a type from its id ({@code moving-average}) or constant name ({@code MOVING_AVERAGE}),
     * ignoring case.
     *
     * @throws IllegalArgumentException for an unknown type
     */
    public static ConnectorType fromId(String text) {
        String normalized = text.trim();
        return Arrays.stream(values())
            .filter(t -> t.id.equalsIgnoreCase(normalized) || t.name().equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown connector type: " + text));
    }
}
