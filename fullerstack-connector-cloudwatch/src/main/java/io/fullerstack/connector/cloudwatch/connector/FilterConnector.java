package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.cloudwatch.fetch.MetricFetcher;
import io.fullerstack.connector.cloudwatch.fetch.SeriesRequest;
import io.fullerstack.connector.core.args.Argument;
import io.fullerstack.connector.core.args.ArgumentKind;
import io.fullerstack.connector.core.args.ArgumentSchema;
import io.fullerstack.connector.core.filter.FilterPredicate;
import io.fullerstack.connector.core.filter.ThresholdFilter;
import io.fullerstack.connector.core.model.QueryWindow;
import io.fullerstack.connector.core.model.Timeseries;

import java.util.List;
import java.util.Objects;

/**
 * Runs a metric math expression and keeps the series whose statistic passes a threshold.
 */
public class FilterConnector extends AbstractMetricDataConnector {

    static final String EXPRESSION_ID = "e1";

    private static final ArgumentSchema SCHEMA = ArgumentSchema.of(ArgumentKind.STRING, ArgumentKind.STRING);

    private final MetricFetcher fetcher;

    public FilterConnector(String name, MetricFetcher fetcher) {
        super(name);
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
    }

    @Override
    public ConnectorDescription describe() {
        return new ConnectorDescription(
            name(),
            List.of(
                Argument.of("SEARCH(\"{AWS/EC2,InstanceId} MetricName=CPUUtilization\", \"Average\")"),
                Argument.of("MAX > 70")),
            """
            ## Threshold filter connector
            Returns the series of an expression whose MIN, MAX, AVG or SUM satisfies a condition.
            An empty filter returns every series.

            Arguments: `(expression: string, filter: '<stat> <condition> <value>' or '')`

            `LAMBDA('%s', 'SEARCH("{AWS/EC2,InstanceId} MetricName=CPUUtilization", "Average")', 'MAX > 70')`
            """.formatted(name()));
    }

    @Override
    protected ArgumentSchema schema() {
        return SCHEMA;
    }

    @Override
    protected List<Timeseries> compute(MetricDataRequest request) {
        String expression = request.argument(0).asString();
        ThresholdFilter filter = new ThresholdFilter(FilterPredicate.parse(request.argument(1).asString()));
        QueryWindow window = request.window();

        List<Timeseries> candidates = fetcher.fetch(request.region(), window.startTime(), window.endTime(),
                List.of(SeriesRequest.expression(EXPRESSION_ID, expression, window.period())))
            .byId(EXPRESSION_ID);
        return filter.apply(candidates);
    }
}
