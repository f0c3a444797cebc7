package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.cloudwatch.fetch.MetricDataResponse;
import io.fullerstack.connector.cloudwatch.fetch.MetricFetcher;
import io.fullerstack.connector.cloudwatch.fetch.SeriesRequest;
import io.fullerstack.connector.core.args.Argument;
import io.fullerstack.connector.core.error.ErrorCategory;
import io.fullerstack.connector.core.histogram.Bucket;
import io.fullerstack.connector.core.histogram.HistogramQuantizer;
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
 * Unit tests for HistogramConnector.
 */
@ExtendWith(MockitoExtension.class)
class HistogramConnectorTest {

    private static final QueryWindow WINDOW = new QueryWindow(0, 3600, 60);
    private static final String METRIC = "AWS/Lambda, Duration";

    @Mock
    private MetricFetcher fetcher;

    @Captor
    private ArgumentCaptor<List<SeriesRequest>> queries;

    private HistogramConnector connector;

    @BeforeEach
    void setUp() {
        connector = new HistogramConnector("histogram-fn", fetcher);
    }

    @Test
    void shouldBuildSingleBucketWhenMinimumIsBelowFloor() {
        // Given: Basic stats with a minimum below the histogram floor, then half the samples in the bucket
        when(fetcher.fetch(anyString(), anyLong(), anyLong(), anyList()))
            .thenReturn(basicStats(0.00001, 250, 400), bucketPercentages("b1", 50.0));

        // When
        ConnectorResult result = connector.getMetricData(request(Argument.of(METRIC), Argument.of(1)));

        // Then: One bucket holding half of the 400 samples
        Bucket expected = new HistogramQuantizer(1).buckets(0.00001, 250, null).get(0);
        List<Timeseries> series = ((ConnectorResult.Success) result).series();
        assertThat(series).hasSize(1);
        assertThat(series.get(0).label()).isEqualTo(expected.label());
        assertThat(series.get(0).unit()).isEqualTo("Count");
        assertThat(series.get(0).values()).containsExactly(200.0);
    }

    @Test
    void shouldQueryWholeWindowAsSinglePeriod() {
        // Given
        when(fetcher.fetch(anyString(), anyLong(), anyLong(), anyList()))
            .thenReturn(basicStats(1, 5000, 10), MetricDataResponse.empty());

        // When
        connector.getMetricData(request(Argument.of(METRIC), Argument.of(20)));

        // Then: Basic stats first, then one percentile-rank query per bucket
        verify(fetcher, times(2)).fetch(eq("us-east-1"), eq(0L), eq(3600L), queries.capture());
        List<SeriesRequest> statQueries = queries.getAllValues().get(0);
        assertThat(statQueries).extracting(SeriesRequest::id)
            .containsExactly("mMinimum", "mMaximum", "mSampleCount", "mSum");
        assertThat(statQueries).extracting(SeriesRequest::period).containsOnly(3660);

        List<SeriesRequest> bucketQueries = queries.getAllValues().get(1);
        assertThat(bucketQueries).hasSizeBetween(2, 20);
        assertThat(bucketQueries.get(0).id()).isEqualTo("b1");
        assertThat(bucketQueries).allSatisfy(q -> {
            assertThat(q.stat()).startsWith("PR(");
            assertThat(q.period()).isEqualTo(3660);
            assertThat(q.label()).isNotBlank();
        });
    }

    @Test
    void shouldReturnEmptyBucketWhenBackendOmitsIt() {
        when(fetcher.fetch(anyString(), anyLong(), anyLong(), anyList()))
            .thenReturn(basicStats(10, 12, 5), MetricDataResponse.empty());

        ConnectorResult result = connector.getMetricData(request(Argument.of(METRIC)));

        List<Timeseries> series = ((ConnectorResult.Success) result).series();
        assertThat(series).isNotEmpty().allSatisfy(s -> {
            assertThat(s.isEmpty()).isTrue();
            assertThat(s.unit()).isEqualTo("Count");
        });
    }

    @Test
    void shouldAcceptBucketCountAsStringAndLabelUnit() {
        when(fetcher.fetch(anyString(), anyLong(), anyLong(), anyList()))
            .thenReturn(basicStats(1, 100_000, 10), MetricDataResponse.empty());

        connector.getMetricData(request(Argument.of(METRIC), Argument.of("5"), Argument.of("Milliseconds")));

        verify(fetcher, times(2)).fetch(anyString(), anyLong(), anyLong(), queries.capture());
        assertThat(queries.getAllValues().get(1)).hasSizeLessThanOrEqualTo(5)
            .allSatisfy(q -> assertThat(q.label()).endsWith("s"));
    }

    @Test
    void shouldStillQueryBucketsWhenWindowHasNoSamples() {
        // Given: All basic statistics are zero
        when(fetcher.fetch(anyString(), anyLong(), anyLong(), anyList()))
            .thenReturn(basicStats(0, 0, 0), bucketPercentages("b1", 100.0));

        // When
        ConnectorResult result = connector.getMetricData(request(Argument.of(METRIC), Argument.of(1)));

        // Then: One bucket is queried and its count is zero
        List<Timeseries> series = ((ConnectorResult.Success) result).series();
        assertThat(series).hasSize(1);
        assertThat(series.get(0).values()).containsExactly(0.0);
        assertThat(series.get(0).unit()).isEqualTo("Count");
        verify(fetcher, times(2)).fetch(anyString(), anyLong(), anyLong(), queries.capture());
        assertThat(queries.getAllValues().get(1)).extracting(SeriesRequest::id).containsExactly("b1");
    }

    @Test
    void shouldRejectBucketCountOutOfRange() {
        ConnectorResult result = connector.getMetricData(request(Argument.of(METRIC), Argument.of(501)));

        assertThat(result).isEqualTo(ConnectorResult.failure(
            ErrorCategory.VALIDATION, "Bucket count (501) outside of valid range (1 to 500)"));
        verifyNoInteractions(fetcher);
    }

    @Test
    void shouldRejectNonNumericBucketCount() {
        ConnectorResult result = connector.getMetricData(request(Argument.of(METRIC), Argument.of("lots")));

        assertThat(result).isEqualTo(ConnectorResult.failure(
            ErrorCategory.VALIDATION, "Expected an integer argument, received 'lots'"));
        verifyNoInteractions(fetcher);
    }

    @Test
    void shouldRejectMissingMetric() {
        ConnectorResult result = connector.getMetricData(request());

        assertThat(result).isEqualTo(ConnectorResult.failure(
            ErrorCategory.VALIDATION, "Expected 1 to 3 arguments, received 0"));
    }

    @Test
    void shouldComputeRangePeriodAsNextMultipleOfPeriod() {
        assertThat(HistogramConnector.rangePeriod(new QueryWindow(0, 3600, 60))).isEqualTo(3660);
        assertThat(HistogramConnector.rangePeriod(new QueryWindow(0, 3630, 60))).isEqualTo(3660);
        assertThat(HistogramConnector.rangePeriod(new QueryWindow(100, 160, 300))).isEqualTo(300);
    }

    private static MetricDataRequest request(Argument... arguments) {
        return new MetricDataRequest(WINDOW, List.of(arguments), "us-east-1");
    }

    private static MetricDataResponse basicStats(double min, double max, double sampleCount) {
        return new MetricDataResponse(List.of(
            stat("mMinimum", min),
            stat("mMaximum", max),
            stat("mSampleCount", sampleCount),
            stat("mSum", sampleCount * (min + max) / 2)));
    }

    private static MetricDataResponse.Result stat(String id, double value) {
        return new MetricDataResponse.Result(id, Timeseries.of(id, List.of(0L), List.of(value)));
    }

    private static MetricDataResponse bucketPercentages(String id, double percent) {
        return new MetricDataResponse(List.of(stat(id, percent)));
    }
}
