package io.fullerstack.connector.core.filter;

import java.util.List;

/**
 * Minimum, maximum, sum and average of a non-empty list of values.
 *
 * @param min   smallest value
 * @param max   largest value
 * @param sum   sum of all values
 * @param avg   arithmetic mean
 * @param count number of values
 */
public record SeriesStatistics(double min, double max, double sum, double avg, int count) {

    /**
     * Compute all statistics in a single pass.
     *
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static SeriesStatistics of(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Statistics need at least one value");
        }
        double min = values.get(0);
        double max = min;
        double sum = 0;
        for (double value : values) {
            sum += value;
            if (value < min) {
                min = value;
            }
            if (value > max) {
                max = value;
            }
        }
        return new SeriesStatistics(min, max, sum, sum / values.size(), values.size());
    }
}
