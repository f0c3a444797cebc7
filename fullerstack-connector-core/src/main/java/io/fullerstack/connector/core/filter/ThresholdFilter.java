package io.fullerstack.connector.core.filter;

import io.fullerstack.connector.core.model.Timeseries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Keeps the series whose aggregate statistic satisfies a {@link FilterPredicate}.
 * <p>
 * Two rules apply before any statistic is computed:
 * <ul>
 *   <li>the empty predicate keeps every series, including series without data</li>
 *   <li>a non-empty predicate never keeps a series without data</li>
 * </ul>
 */
public final class ThresholdFilter {

    private static final Logger logger = LoggerFactory.getLogger(ThresholdFilter.class);

    private final FilterPredicate predicate;

    public ThresholdFilter(FilterPredicate predicate) {
        this.predicate = Objects.requireNonNull(predicate, "predicate cannot be null");
    }

    public FilterPredicate predicate() {
        return predicate;
    }

    public boolean matches(Timeseries series) {
        if (predicate.isEmpty()) {
            return true;
        }
        if (series.isEmpty()) {
            return false;
        }
        return predicate.test(SeriesStatistics.of(series.values()));
    }

    /**
     * Matching series in input order.
     */
    public List<Timeseries> apply(List<Timeseries> candidates) {
        List<Timeseries> kept = candidates.stream()
            .filter(this::matches)
            .toList();
        logger.debug("Filter {} kept {} of {} series", predicate, kept.size(), candidates.size());
        return kept;
    }
}
