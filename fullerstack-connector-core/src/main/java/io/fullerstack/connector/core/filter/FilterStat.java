package io.fullerstack.connector.core.filter;

import java.util.function.ToDoubleFunction;

/**
 * Aggregate statistic a filter compares against its threshold.
 */
public enum FilterStat {

    MIN(SeriesStatistics::min),
    MAX(SeriesStatistics::max),
    AVG(SeriesStatistics::avg),
    SUM(SeriesStatistics::sum);

    private final ToDoubleFunction<SeriesStatistics> extractor;

    FilterStat(ToDoubleFunction<SeriesStatistics> extractor) {
        this.extractor = extractor;
    }

    public double select(SeriesStatistics statistics) {
        return extractor.applyAsDouble(statistics);
    }
}
