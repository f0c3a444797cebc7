package io.fullerstack.connector.cloudwatch.connector;

/**
 * A data source connector answering describe and compute invocations.
 */
public interface MetricDataConnector {

    ConnectorDescription describe();

    /**
     * Compute derived series for {@code request}.
     * <p>
     * Never throws; every failure is returned as {@link ConnectorResult.Failure}.
     */
    ConnectorResult getMetricData(MetricDataRequest request);
}
