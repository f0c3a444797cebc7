package io.fullerstack.connector.core.filter;

import io.fullerstack.connector.core.error.ValidationException;

import java.util.Objects;

/**
 * Condition of the form {@code <stat> <condition> <value>}, e.g. {@code MAX > 70}.
 * <p>
 * The empty predicate, parsed from a blank string, matches every series.
 */
public final class FilterPredicate {

    private static final FilterPredicate EMPTY = new FilterPredicate(null, null, Double.NaN);

    private final FilterStat stat;
    private final Comparison comparison;
    private final double threshold;

    private FilterPredicate(FilterStat stat, Comparison comparison, double threshold) {
        this.stat = stat;
        this.comparison = comparison;
        this.threshold = threshold;
    }

    public static FilterPredicate of(FilterStat stat, Comparison comparison, double threshold) {
        return new FilterPredicate(
            Objects.requireNonNull(stat, "stat cannot be null"),
            Objects.requireNonNull(comparison, "comparison cannot be null"),
            threshold);
    }

    public static FilterPredicate empty() {
        return EMPTY;
    }

    /**
     * Parse filter text. Repeated spaces are collapsed; blank text gives the empty predicate.
     *
     * @throws ValidationException on a wrong token count or an unknown stat, condition or value
     */
    public static FilterPredicate parse(String text) {
        String normalized = text == null ? "" : text.replaceAll(" +", " ").trim();
        if (normalized.isEmpty()) {
            return EMPTY;
        }
        String[] parts = normalized.split(" ");
        if (parts.length != 3) {
            throw new ValidationException("Filter syntax error, '" + text
                + "' does not follow format '<stat> <condition> <value>' or empty, ''");
        }

        FilterStat stat;
        try {
            stat = FilterStat.valueOf(parts[0]);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unrecognised stat, '" + parts[0] + "' in filter", e);
        }
        Comparison comparison = Comparison.fromSymbol(parts[1])
            .orElseThrow(() -> new ValidationException("Unrecognised condition, '" + parts[1] + "' in filter"));
        double threshold;
        try {
            threshold = Double.parseDouble(parts[2]);
        } catch (NumberFormatException e) {
            throw new ValidationException("Unrecognised value, '" + parts[2] + "' in filter", e);
        }
        return new FilterPredicate(stat, comparison, threshold);
    }

    public boolean isEmpty() {
        return stat == null;
    }

    /**
     * Evaluate against precomputed statistics. Only meaningful for a non-empty predicate.
     */
    public boolean test(SeriesStatistics statistics) {
        if (isEmpty()) {
            return true;
        }
        return comparison.test(stat.select(statistics), threshold);
    }

    public FilterStat stat() {
        return stat;
    }

    public Comparison comparison() {
        return comparison;
    }

    public double threshold() {
        return threshold;
    }

    @Override
    public String toString() {
        return isEmpty() ? "<empty>" : stat + " " + comparison.symbol() + " " + threshold;
    }
}
