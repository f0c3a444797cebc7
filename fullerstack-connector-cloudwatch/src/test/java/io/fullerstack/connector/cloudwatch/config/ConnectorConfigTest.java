package io.fullerstack.connector.cloudwatch.config;

import io.fullerstack.connector.cloudwatch.connector.EchoConnector;
import io.fullerstack.connector.cloudwatch.connector.FilterConnector;
import io.fullerstack.connector.cloudwatch.connector.HistogramConnector;
import io.fullerstack.connector.cloudwatch.connector.MetricDataConnector;
import io.fullerstack.connector.cloudwatch.connector.MovingAverageConnector;
import io.fullerstack.connector.cloudwatch.connector.MultiRegionConnector;
import io.fullerstack.connector.cloudwatch.connector.TimeShiftConnector;
import io.fullerstack.connector.cloudwatch.fetch.MetricFetcher;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for ConnectorConfig and Connectors.
 */
class ConnectorConfigTest {

    @Test
    void shouldUseDefaultsForEmptyEnvironment() {
        ConnectorConfig config = ConnectorConfig.fromEnvironment(Map.of());

        assertThat(config).isEqualTo(ConnectorConfig.defaults());
        assertThat(config.type()).isEqualTo(ConnectorType.ECHO);
        assertThat(config.functionName()).isEqualTo("metric-connector");
        assertThat(config.defaultRegion()).isEqualTo("us-east-1");
        assertThat(config.maxParallelism()).isEqualTo(10);
    }

    @Test
    void shouldReadEnvironmentVariables() {
        ConnectorConfig config = ConnectorConfig.fromEnvironment(Map.of(
            "CONNECTOR_TYPE", "multi-region",
            "AWS_LAMBDA_FUNCTION_NAME", "regions-fn",
            "AWS_REGION", "eu-west-1",
            "MULTI_REGION_MAX_PARALLELISM", " 4 "));

        assertThat(config).isEqualTo(new ConnectorConfig(ConnectorType.MULTI_REGION, "regions-fn", "eu-west-1", 4));
    }

    @Test
    void shouldAcceptConstantNamesForType() {
        assertThat(ConnectorType.fromId("MOVING_AVERAGE")).isEqualTo(ConnectorType.MOVING_AVERAGE);
        assertThat(ConnectorType.fromId("TimeShift")).isEqualTo(ConnectorType.TIMESHIFT);
    }

    @Test
    void shouldRejectInvalidEnvironment() {
        assertThatThrownBy(() -> ConnectorConfig.fromEnvironment(Map.of("CONNECTOR_TYPE", "forecast")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown connector type: forecast");
        assertThatThrownBy(() -> ConnectorConfig.fromEnvironment(Map.of("MULTI_REGION_MAX_PARALLELISM", "many")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConnectorConfig.fromEnvironment(Map.of("MULTI_REGION_MAX_PARALLELISM", "0")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCreateConfiguredConnector() {
        MetricFetcher fetcher = mock(MetricFetcher.class);

        assertThat(create(ConnectorType.ECHO, fetcher)).isInstanceOf(EchoConnector.class);
        assertThat(create(ConnectorType.MOVING_AVERAGE, fetcher)).isInstanceOf(MovingAverageConnector.class);
        assertThat(create(ConnectorType.TIMESHIFT, fetcher)).isInstanceOf(TimeShiftConnector.class);
        assertThat(create(ConnectorType.HISTOGRAM, fetcher)).isInstanceOf(HistogramConnector.class);
        assertThat(create(ConnectorType.FILTER, fetcher)).isInstanceOf(FilterConnector.class);
        assertThat(create(ConnectorType.MULTI_REGION, fetcher)).isInstanceOf(MultiRegionConnector.class);
        assertThat(create(ConnectorType.HISTOGRAM, fetcher).describe().name()).isEqualTo("fn");
    }

    private static MetricDataConnector create(ConnectorType type, MetricFetcher fetcher) {
        return Connectors.create(new ConnectorConfig(type, "fn", "us-east-1", 2), fetcher);
    }
}
