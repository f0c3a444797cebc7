package io.fullerstack.connector.cloudwatch.fetch;

import io.fullerstack.connector.core.error.ConnectorException;
import io.fullerstack.connector.core.error.ErrorCategory;

/**
 * Exception thrown when the metric backend cannot be queried.
 */
public class MetricFetchException extends ConnectorException {

    public MetricFetchException(String message) {
        super(ErrorCategory.INTERNAL_ERROR, message);
    }

    public MetricFetchException(String message, Throwable cause) {
        super(ErrorCategory.INTERNAL_ERROR, message, cause);
    }
}
