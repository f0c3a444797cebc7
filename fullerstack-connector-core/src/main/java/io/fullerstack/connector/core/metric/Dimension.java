package io.fullerstack.connector.core.metric;

import java.util.Objects;

/**
 * Metric dimension name/value pair.
 */
public record Dimension(String name, String value) {

    public Dimension {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }
}
