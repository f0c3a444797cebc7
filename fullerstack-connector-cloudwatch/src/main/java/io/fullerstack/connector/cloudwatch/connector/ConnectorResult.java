package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.core.error.ErrorCategory;
import io.fullerstack.connector.core.model.Timeseries;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a compute invocation: the derived series, or one categorized failure.
 */
public sealed interface ConnectorResult permits ConnectorResult.Success, ConnectorResult.Failure {

    static ConnectorResult success(List<Timeseries> series) {
        return new Success(series);
    }

    static ConnectorResult failure(ErrorCategory category, String message) {
        return new Failure(category, message);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success(List<Timeseries> series) implements ConnectorResult {
        public Success {
            series = List.copyOf(Objects.requireNonNull(series, "series cannot be null"));
        }
    }

    record Failure(ErrorCategory category, String message) implements ConnectorResult {
        public Failure {
            Objects.requireNonNull(category, "category cannot be null");
            message = message == null ? "" : message;
        }
    }
}
