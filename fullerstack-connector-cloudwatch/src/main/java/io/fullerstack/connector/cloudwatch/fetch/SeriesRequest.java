package io.fullerstack.connector.cloudwatch.fetch;

import io.fullerstack.connector.core.metric.MetricName;

import java.util.Objects;

/**
 * One query sent to the metric backend: either a metric statistic or a metric math expression.
 *
 * @param id         query id, unique within one fetch; results are matched back by it
 * @param label      display label, null to let the backend choose one
 * @param metric     metric to read, null for an expression query
 * @param stat       statistic of {@code metric}, e.g. {@code Average} or {@code PR(1:10)}
 * @param expression metric math expression, null for a metric query
 * @param period     sampling period in seconds
 */
public record SeriesRequest(
    String id,
    String label,
    MetricName metric,
    String stat,
    String expression,
    int period
) {

    public SeriesRequest {
        Objects.requireNonNull(id, "id cannot be null");
        if ((metric == null) == (expression == null)) {
            throw new IllegalArgumentException("Query " + id + " needs exactly one of metric or expression");
        }
        if (metric != null) {
            Objects.requireNonNull(stat, "stat cannot be null for a metric query");
        }
        if (period <= 0) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
    }

    public static SeriesRequest metricStat(String id, MetricName metric, String stat, int period) {
        return new SeriesRequest(id, null, metric, stat, null, period);
    }

    public static SeriesRequest expression(String id, String expression, int period) {
        return new SeriesRequest(id, null, null, null, expression, period);
    }

    public SeriesRequest withLabel(String newLabel) {
        return new SeriesRequest(id, newLabel, metric, stat, expression, period);
    }

    public boolean isExpression() {
        return expression != null;
    }
}
