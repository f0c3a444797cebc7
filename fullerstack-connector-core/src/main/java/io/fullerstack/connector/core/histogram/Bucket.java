package io.fullerstack.connector.core.histogram;

/**
 * One histogram bucket covering {@code [bottom, top)}.
 *
 * @param binNumber log bin whose upper edge closes the bucket
 * @param bottom    inclusive lower bound
 * @param top       exclusive upper bound
 * @param label     display label for the bucket's midpoint
 */
public record Bucket(int binNumber, double bottom, double top, String label) {

    /**
     * Percentile-rank statistic selecting the share of samples inside this bucket,
     * e.g. {@code PR(10.0000:11.0000)}.
     */
    public String percentileRangeStat() {
        return "PR(" + ValueLabels.toPrecision(bottom, 6) + ":" + ValueLabels.toPrecision(top, 6) + ")";
    }
}
