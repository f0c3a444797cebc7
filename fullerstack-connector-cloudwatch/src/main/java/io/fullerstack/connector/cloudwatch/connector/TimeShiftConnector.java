package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.cloudwatch.fetch.MetricFetcher;
import io.fullerstack.connector.cloudwatch.fetch.SeriesRequest;
import io.fullerstack.connector.core.args.Argument;
import io.fullerstack.connector.core.args.ArgumentKind;
import io.fullerstack.connector.core.args.ArgumentSchema;
import io.fullerstack.connector.core.duration.CalendarDuration;
import io.fullerstack.connector.core.metric.MetricName;
import io.fullerstack.connector.core.model.QueryWindow;
import io.fullerstack.connector.core.model.Timeseries;
import io.fullerstack.connector.core.transform.TimeShift;

import java.util.List;
import java.util.Objects;

/**
 * Overlays a metric with copies of itself shifted back by whole multiples of an interval.
 * <p>
 * One fetch covers the current window and every shifted window.
 */
public class TimeShiftConnector extends AbstractMetricDataConnector {

    static final String METRIC_ID = "m1";

    private static final ArgumentSchema SCHEMA = ArgumentSchema.of(
        ArgumentKind.STRING, ArgumentKind.STRING, ArgumentKind.STRING, ArgumentKind.NUMBER);

    private final MetricFetcher fetcher;

    public TimeShiftConnector(String name, MetricFetcher fetcher) {
        super(name);
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
    }

    @Override
    public ConnectorDescription describe() {
        return new ConnectorDescription(
            name(),
            List.of(
                Argument.of("AWS/Usage, CallCount, Type, API, Resource, GetMetricData, Service, CloudWatch, Class, None"),
                Argument.of("Sum"),
                Argument.of("P1D"),
                Argument.of(7)),
            """
            ## Time shift connector
            Compares a metric with the same metric one or more intervals in the past.

            Arguments: `(metric: string, stat: string, interval: ISO 8601 duration, shifts: 1 to 10)`

            `LAMBDA('%s', 'AWS/Usage, CallCount, Type, API, Resource, GetMetricData, Service, CloudWatch, Class, None', 'Sum', 'P1D', 7)`
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
        long shiftSeconds = CalendarDuration.parsePositiveSeconds(request.argument(2).asString());
        TimeShift timeShift = new TimeShift(shiftSeconds, request.argument(3).asInteger());
        QueryWindow window = request.window();

        Timeseries raw = fetcher.fetch(request.region(), timeShift.fetchStart(window), window.endTime(),
                List.of(SeriesRequest.metricStat(METRIC_ID, metric, stat, window.period())))
            .first(METRIC_ID)
            .orElseGet(() -> Timeseries.empty(metric.metricName()));

        return timeShift.apply(raw, window);
    }
}
