package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.core.args.ArgumentSchema;
import io.fullerstack.connector.core.error.ConnectorException;
import io.fullerstack.connector.core.error.ErrorCategory;
import io.fullerstack.connector.core.model.Timeseries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Base class validating arguments and turning exceptions into {@link ConnectorResult.Failure}.
 * <p>
 * Subclasses implement {@link #compute(MetricDataRequest)} and may throw freely; arguments
 * have already been checked against {@link #schema()} when it runs.
 *
 * @author Fullerstack
 */
public abstract class AbstractMetricDataConnector implements MetricDataConnector {

    private static final Logger logger = LoggerFactory.getLogger(AbstractMetricDataConnector.class);

    private final String name;

    protected AbstractMetricDataConnector(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public String name() {
        return name;
    }

    protected abstract ArgumentSchema schema();

    protected abstract List<Timeseries> compute(MetricDataRequest request);

    @Override
    public final ConnectorResult getMetricData(MetricDataRequest request) {
        try {
            schema().validate(request.arguments());
            List<Timeseries> series = compute(request);
            logger.debug("{} returned {} series for {}", name, series.size(), request.window());
            return ConnectorResult.success(series);

        } catch (ConnectorException e) {
            if (e.category() == ErrorCategory.VALIDATION) {
                logger.warn("{} rejected arguments {}: {}", name, request.arguments(), e.getMessage());
            } else {
                logger.error("{} failed for {}", name, request.window(), e);
            }
            return ConnectorResult.failure(e.category(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("{} failed unexpectedly for {}", name, request.window(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ConnectorResult.failure(ErrorCategory.INTERNAL_ERROR, message);
        }
    }
}
