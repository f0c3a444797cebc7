package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.cloudwatch.fetch.MetricDataResponse;
import io.fullerstack.connector.cloudwatch.fetch.MetricFetcher;
import io.fullerstack.connector.cloudwatch.fetch.SeriesRequest;
import io.fullerstack.connector.core.args.Argument;
import io.fullerstack.connector.core.args.ArgumentKind;
import io.fullerstack.connector.core.args.ArgumentSchema;
import io.fullerstack.connector.core.histogram.Bucket;
import io.fullerstack.connector.core.histogram.HistogramQuantizer;
import io.fullerstack.connector.core.metric.MetricName;
import io.fullerstack.connector.core.model.QueryWindow;
import io.fullerstack.connector.core.model.Timeseries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logarithmic histogram of a metric over the whole query window.
 * <p>
 * Works in two fetches, both with a single period spanning the window:
 * <ol>
 *   <li>minimum, maximum, sample count and sum, to place the buckets</li>
 *   <li>one percentile-rank statistic per bucket, converted to a sample count</li>
 * </ol>
 * A window without samples still gets its single bucket queried, with counts of zero.
 */
public class HistogramConnector extends AbstractMetricDataConnector {

    private static final Logger logger = LoggerFactory.getLogger(HistogramConnector.class);

    static final List<String> BASIC_STATS = List.of("Minimum", "Maximum", "SampleCount", "Sum");
    static final String BUCKET_ID_PREFIX = "b";

    private static final ArgumentSchema SCHEMA =
        ArgumentSchema.withOptional(1, ArgumentKind.STRING, ArgumentKind.ANY, ArgumentKind.STRING);

    private final MetricFetcher fetcher;

    public HistogramConnector(String name, MetricFetcher fetcher) {
        super(name);
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
    }

    @Override
    public ConnectorDescription describe() {
        return new ConnectorDescription(
            name(),
            List.of(Argument.of("AWS/Lambda, Duration"), Argument.of(HistogramQuantizer.DEFAULT_BUCKET_COUNT)),
            """
            ## Histogram connector
            Plots the distribution of a metric that supports percentiles on a logarithmic scale.
            Use the bar chart visualization; each bar counts the samples in one bucket and is
            labelled with the bucket's center value.

            Arguments: `(metric: string[, buckets: 1 to 500, default 100[, unit: string]])`

            `LAMBDA('%s', 'AWS/Lambda, Duration', 100)`
            """.formatted(name()));
    }

    @Override
    protected ArgumentSchema schema() {
        return SCHEMA;
    }

    @Override
    protected List<Timeseries> compute(MetricDataRequest request) {
        MetricName metric = MetricName.parse(request.argument(0).asString());
        HistogramQuantizer quantizer = request.hasArgument(1)
            ? new HistogramQuantizer(request.argument(1).asInteger())
            : HistogramQuantizer.withDefaults();
        String unit = request.hasArgument(2) ? request.argument(2).asString() : null;
        QueryWindow window = request.window();
        int rangePeriod = rangePeriod(window);

        BasicStats stats = fetchBasicStats(request.region(), metric, window, rangePeriod);
        List<Bucket> buckets = quantizer.buckets(stats.minimum(), stats.maximum(), unit);
        List<SeriesRequest> queries = new ArrayList<>(buckets.size());
        for (int k = 0; k < buckets.size(); k++) {
            Bucket bucket = buckets.get(k);
            queries.add(SeriesRequest.metricStat(bucketId(k), metric, bucket.percentileRangeStat(), rangePeriod)
                .withLabel(bucket.label()));
        }
        MetricDataResponse response = fetcher.fetch(request.region(), window.startTime(), window.endTime(), queries);

        List<Timeseries> counts = new ArrayList<>(buckets.size());
        for (int k = 0; k < buckets.size(); k++) {
            String label = buckets.get(k).label();
            Timeseries percentages = response.first(bucketId(k))
                .map(series -> series.withLabel(label))
                .orElseGet(() -> Timeseries.empty(label));
            counts.add(quantizer.toCounts(percentages, stats.sampleCount()));
        }
        return counts;
    }

    /**
     * Smallest multiple of the period strictly larger than the window range.
     */
    static int rangePeriod(QueryWindow window) {
        long range = window.range();
        return Math.toIntExact(range - range % window.period() + window.period());
    }

    private BasicStats fetchBasicStats(String region, MetricName metric, QueryWindow window, int rangePeriod) {
        List<SeriesRequest> queries = BASIC_STATS.stream()
            .map(stat -> SeriesRequest.metricStat("m" + stat, metric, stat, rangePeriod))
            .toList();
        MetricDataResponse response = fetcher.fetch(region, window.startTime(), window.endTime(), queries);

        BasicStats stats = new BasicStats(
            firstValue(response, "mMinimum"),
            firstValue(response, "mMaximum"),
            firstValue(response, "mSampleCount"),
            firstValue(response, "mSum"));
        logger.debug("Basic stats of {}: {}", metric, stats);
        return stats;
    }

    private static double firstValue(MetricDataResponse response, String id) {
        return response.first(id)
            .filter(series -> !series.isEmpty())
            .map(series -> series.values().get(0))
            .orElse(0.0);
    }

    private static String bucketId(int index) {
        return BUCKET_ID_PREFIX + (index + 1);
    }

    record BasicStats(double minimum, double maximum, double sampleCount, double sum) {
    }
}
