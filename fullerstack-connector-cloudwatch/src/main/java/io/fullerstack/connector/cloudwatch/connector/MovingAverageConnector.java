package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.cloudwatch.fetch.MetricDataResponse;
import io.fullerstack.connector.cloudwatch.fetch.MetricFetcher;
import io.fullerstack.connector.cloudwatch.fetch.SeriesRequest;
import io.fullerstack.connector.core.args.Argument;
import io.fullerstack.connector.core.args.ArgumentKind;
import io.fullerstack.connector.core.args.ArgumentSchema;
import io.fullerstack.connector.core.metric.MetricName;
import io.fullerstack.connector.core.model.QueryWindow;
import io.fullerstack.connector.core.model.Timeseries;
import io.fullerstack.connector.core.model.TimestampIndex;
import io.fullerstack.connector.core.transform.MovingAverage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Trailing moving average of one metric over the last N periods.
 * <p>
 * Next to the metric, a {@code TIME_SERIES} expression is fetched over the same range; its
 * earliest timestamp is the first grid point the backend actually covers and anchors the walk.
 */
public class MovingAverageConnector extends AbstractMetricDataConnector {

    private static final Logger logger = LoggerFactory.getLogger(MovingAverageConnector.class);

    static final String METRIC_ID = "m1";
    static final String TIMER_ID = "timer";
    static final String TIMER_EXPRESSION = "TIME_SERIES(10)";

    private static final ArgumentSchema SCHEMA =
        ArgumentSchema.of(ArgumentKind.STRING, ArgumentKind.STRING, ArgumentKind.NUMBER);

    private final MetricFetcher fetcher;

    public MovingAverageConnector(String name, MetricFetcher fetcher) {
        super(name);
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
    }

    @Override
    public ConnectorDescription describe() {
        return new ConnectorDescription(
            name(),
            List.of(Argument.of("AWS/Lambda,Duration"), Argument.of("Average"), Argument.of(10)),
            """
            ## Moving average connector
            Each datapoint is the average of the metric over the current and the N - 1 preceding periods.
            Missing datapoints are left out of the average.

            Arguments: `(metric: string, stat: string, N: number >= 2)`

            `LAMBDA('%s', 'AWS/Lambda,Duration', 'Average', 10)`
            """.formatted(name()));
    }

    @Override
    protected ArgumentSchema schema() {
        return SCHEMA;
    }

    @Override
    protected List<Timeseries> compute(MetricDataRequest request) {
        MetricName metric = MetricName.parse(request.argument(0).asString());
        String stat = request.argument(1).asString();
        MovingAverage movingAverage = new MovingAverage(request.argument(2).asInteger());
        QueryWindow window = request.window();

        long lookbackStart = movingAverage.lookbackStart(window);
        MetricDataResponse response = fetcher.fetch(request.region(), lookbackStart, window.endTime(), List.of(
            SeriesRequest.metricStat(METRIC_ID, metric, stat, window.period()),
            SeriesRequest.expression(TIMER_ID, TIMER_EXPRESSION, window.period())));

        Timeseries raw = response.first(METRIC_ID).orElseGet(() -> Timeseries.empty(metric.metricName()));
        long anchor = response.first(TIMER_ID)
            .map(timer -> TimestampIndex.of(timer).earliest().orElse(lookbackStart))
            .orElse(lookbackStart);
        logger.debug("Moving average of {} over {} datapoints anchored at {}",
            metric, movingAverage.windowLength(), anchor);

        return List.of(movingAverage.apply(raw, anchor, window));
    }
}
