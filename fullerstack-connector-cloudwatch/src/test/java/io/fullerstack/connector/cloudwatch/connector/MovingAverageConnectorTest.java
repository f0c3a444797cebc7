package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.cloudwatch.fetch.MetricDataResponse;
import io.fullerstack.connector.cloudwatch.fetch.MetricFetchException;
import io.fullerstack.connector.cloudwatch.fetch.MetricFetcher;
import io.fullerstack.connector.cloudwatch.fetch.SeriesRequest;
import io.fullerstack.connector.core.args.Argument;
import io.fullerstack.connector.core.error.ErrorCategory;
import io.fullerstack.connector.core.metric.MetricName;
import io.fullerstack.connector.core.model.QueryWindow;
import io.fullerstack.connector.core.model.Timeseries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MovingAverageConnector.
 */
@ExtendWith(MockitoExtension.class)
class MovingAverageConnectorTest {

    private static final QueryWindow WINDOW = new QueryWindow(1000, 1600, 60);
    private static final String METRIC = "AWS/Lambda,Duration";

    @Mock
    private MetricFetcher fetcher;

    @Captor
    private ArgumentCaptor<List<SeriesRequest>> queries;

    private MovingAverageConnector connector;

    @BeforeEach
    void setUp() {
        connector = new MovingAverageConnector("avg-fn", fetcher);
    }

    @Test
    void shouldAverageSparseSamplesOverTenDatapoints() {
        // Given: A value of 5 at every other slot from the lookback start (1000 - 9*60 = 460)
        Timeseries.Builder raw = Timeseries.builder("Duration");
        Timeseries.Builder timer = Timeseries.builder("timer");
        for (long t = 460; t < 1600; t += 60) {
            if ((t - 460) % 120 == 0) {
                raw.add(t, 5.0);
            }
            timer.add(t, 10.0);
        }
        when(fetcher.fetch(eq("us-east-1"), eq(460L), eq(1600L), anyList())).thenReturn(new MetricDataResponse(List.of(
            new MetricDataResponse.Result("m1", raw.build()),
            new MetricDataResponse.Result("timer", timer.build()))));

        // When
        ConnectorResult result = connector.getMetricData(request(METRIC, "Average", 10));

        // Then: Ten points inside the window, each the average of the present samples
        assertThat(result).isInstanceOf(ConnectorResult.Success.class);
        Timeseries averaged = ((ConnectorResult.Success) result).series().get(0);
        assertThat(averaged.label()).isEqualTo("Duration");
        assertThat(averaged.timestamps()).containsExactly(1000L, 1060L, 1120L, 1180L, 1240L, 1300L, 1360L, 1420L, 1480L, 1540L);
        assertThat(averaged.values()).containsOnly(5.0);
    }

    @Test
    void shouldQueryMetricAndGridProbe() {
        // Given
        when(fetcher.fetch(anyString(), anyLong(), anyLong(), anyList())).thenReturn(MetricDataResponse.empty());

        // When
        connector.getMetricData(request(METRIC, "p90", 3));

        // Then: Lookback of two periods before the window
        verify(fetcher).fetch(eq("us-east-1"), eq(880L), eq(1600L), queries.capture());
        assertThat(queries.getValue()).containsExactly(
            SeriesRequest.metricStat("m1", MetricName.parse(METRIC), "p90", 60),
            SeriesRequest.expression("timer", "TIME_SERIES(10)", 60));
    }

    @Test
    void shouldAnchorWalkAtEarliestProbeTimestamp() {
        // Given: The backend covers history only from 1120 on
        Timeseries raw = Timeseries.of("Duration", List.of(1120L, 1180L), List.of(4.0, 8.0));
        Timeseries timer = Timeseries.of("timer", List.of(1120L, 1180L, 1240L), List.of(10.0, 10.0, 10.0));
        when(fetcher.fetch(anyString(), anyLong(), anyLong(), anyList())).thenReturn(new MetricDataResponse(List.of(
            new MetricDataResponse.Result("timer", timer),
            new MetricDataResponse.Result("m1", raw))));

        // When
        ConnectorResult result = connector.getMetricData(new MetricDataRequest(
            new QueryWindow(1120, 1300, 60), List.of(Argument.of(METRIC), Argument.of("Average"), Argument.of(5)), "us-east-1"));

        // Then
        Timeseries averaged = ((ConnectorResult.Success) result).series().get(0);
        assertThat(averaged.timestamps()).containsExactly(1120L, 1180L, 1240L);
        assertThat(averaged.values()).containsExactly(4.0, 6.0, 6.0);
    }

    @Test
    void shouldReturnEmptySeriesWhenBackendHasNoData() {
        when(fetcher.fetch(anyString(), anyLong(), anyLong(), anyList())).thenReturn(MetricDataResponse.empty());

        ConnectorResult result = connector.getMetricData(request(METRIC, "Average", 10));

        List<Timeseries> series = ((ConnectorResult.Success) result).series();
        assertThat(series).hasSize(1);
        assertThat(series.get(0).isEmpty()).isTrue();
        assertThat(series.get(0).label()).isEqualTo("Duration");
    }

    @Test
    void shouldRejectSingleDatapointWindowBeforeFetching() {
        ConnectorResult result = connector.getMetricData(request(METRIC, "Average", 1));

        assertThat(result).isEqualTo(ConnectorResult.failure(
            ErrorCategory.VALIDATION, "Number of datapoints, 1, must be greater than 1"));
        verifyNoInteractions(fetcher);
    }

    @Test
    void shouldRejectMalformedMetric() {
        ConnectorResult result = connector.getMetricData(request("AWS/Lambda,Duration,FunctionName", "Average", 10));

        assertThat(result).isInstanceOf(ConnectorResult.Failure.class);
        assertThat(((ConnectorResult.Failure) result).message()).startsWith("Malformed full metric name");
        verifyNoInteractions(fetcher);
    }

    @Test
    void shouldReportFetchFailureAsInternalError() {
        when(fetcher.fetch(anyString(), anyLong(), anyLong(), anyList()))
            .thenThrow(new MetricFetchException("Failed to get metric data from us-east-1: boom"));

        ConnectorResult result = connector.getMetricData(request(METRIC, "Average", 10));

        assertThat(result).isEqualTo(ConnectorResult.failure(
            ErrorCategory.INTERNAL_ERROR, "Failed to get metric data from us-east-1: boom"));
    }

    private static MetricDataRequest request(String metric, String stat, int datapoints) {
        return new MetricDataRequest(
            WINDOW, List.of(Argument.of(metric), Argument.of(stat), Argument.of(datapoints)), "us-east-1");
    }
}
