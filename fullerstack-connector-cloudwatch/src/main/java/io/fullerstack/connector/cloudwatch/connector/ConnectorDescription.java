package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.core.args.Argument;

import java.util.List;
import java.util.Objects;

/**
 * Self-description shown by the console when the connector is picked.
 *
 * @param name             display name of the connector
 * @param argumentDefaults example arguments prefilled in the query editor
 * @param description      short markdown description
 */
public record ConnectorDescription(String name, List<Argument> argumentDefaults, String description) {

    public ConnectorDescription {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
        argumentDefaults = argumentDefaults == null ? List.of() : List.copyOf(argumentDefaults);
    }
}
