package io.fullerstack.connector.cloudwatch.config;

import io.fullerstack.connector.cloudwatch.connector.EchoConnector;
import io.fullerstack.connector.cloudwatch.connector.FilterConnector;
import io.fullerstack.connector.cloudwatch.connector.HistogramConnector;
import io.fullerstack.connector.cloudwatch.connector.MetricDataConnector;
import io.fullerstack.connector.cloudwatch.connector.MovingAverageConnector;
import io.fullerstack.connector.cloudwatch.connector.MultiRegionConnector;
import io.fullerstack.connector.cloudwatch.connector.TimeShiftConnector;
import io.fullerstack.connector.cloudwatch.fetch.CloudWatchMetricFetcher;
import io.fullerstack.connector.cloudwatch.fetch.MetricFetcher;

/**
 * Builds the connector named by a {@link ConnectorConfig}.
 */
public final class Connectors {

    private Connectors() {
    }

    public static MetricDataConnector create(ConnectorConfig config) {
        return create(config, new CloudWatchMetricFetcher());
    }

    public static MetricDataConnector create(ConnectorConfig config, MetricFetcher fetcher) {
        String name = config.functionName();
        return switch (config.type()) {
            case ECHO -> new EchoConnector(name);
            case MOVING_AVERAGE -> new MovingAverageConnector(name, fetcher);
            case TIMESHIFT -> new TimeShiftConnector(name, fetcher);
            case HISTOGRAM -> new HistogramConnector(name, fetcher);
            case FILTER -> new FilterConnector(name, fetcher);
            case MULTI_REGION -> new MultiRegionConnector(name, fetcher, config.maxParallelism());
        };
    }
}
