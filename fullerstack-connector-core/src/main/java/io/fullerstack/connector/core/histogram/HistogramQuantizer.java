package io.fullerstack.connector.core.histogram;

import io.fullerstack.connector.core.error.ValidationException;
import io.fullerstack.connector.core.model.Timeseries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a value range into logarithmic buckets and turns per-bucket sample shares into counts.
 * <p>
 * Workflow:
 * <ol>
 *   <li>{@link #buckets(double, double, String)} lays out at most {@code bucketCount}
 *       buckets between the observed minimum and maximum, evenly spaced in
 *       {@link LogBins} space</li>
 *   <li>the backend answers one percentile-rank query per bucket
 *       ({@link Bucket#percentileRangeStat()}) with the percentage of samples inside it</li>
 *   <li>{@link #toCounts(Timeseries, double)} scales those percentages back to sample counts</li>
 * </ol>
 * Minimum values below {@link #MIN_VALUE_FOR_HIST} start the bin walk at that floor;
 * otherwise the logarithm of tiny magnitudes would stretch the range across thousands
 * of empty bins.
 *
 * @author Fullerstack
 */
public final class HistogramQuantizer {

    private static final Logger logger = LoggerFactory.getLogger(HistogramQuantizer.class);

    public static final int DEFAULT_BUCKET_COUNT = 100;
    public static final int MIN_BUCKET_COUNT = 1;
    public static final int MAX_BUCKET_COUNT = 500;
    public static final double MIN_VALUE_FOR_HIST = 0.0001;
    public static final String COUNT_UNIT = "Count";

    private final int bucketCount;

    /**
     * @param bucketCount maximum number of buckets, {@value #MIN_BUCKET_COUNT} to {@value #MAX_BUCKET_COUNT}
     * @throws ValidationException if the count is out of range
     */
    public HistogramQuantizer(int bucketCount) {
        if (bucketCount < MIN_BUCKET_COUNT || bucketCount > MAX_BUCKET_COUNT) {
            throw new ValidationException("Bucket count (" + bucketCount + ") outside of valid range ("
                + MIN_BUCKET_COUNT + " to " + MAX_BUCKET_COUNT + ")");
        }
        this.bucketCount = bucketCount;
    }

    public static HistogramQuantizer withDefaults() {
        return new HistogramQuantizer(DEFAULT_BUCKET_COUNT);
    }

    public int bucketCount() {
        return bucketCount;
    }

    /**
     * Lay out buckets covering {@code [min, max]}.
     * <p>
     * The bin span between the (floored) minimum and the maximum is divided into
     * {@code bucketCount} fractional steps, each rounded to the nearest bin. Steps that
     * round onto the bin of the previous bucket are merged into it, so narrow ranges
     * produce fewer buckets. The first bucket starts at the raw {@code min}; each next
     * bucket starts where the previous one ends.
     *
     * @param min  smallest observed value
     * @param max  largest observed value
     * @param unit metric unit used for labels; may be null
     */
    public List<Bucket> buckets(double min, double max, String unit) {
        int minBin = LogBins.binOf(min < MIN_VALUE_FOR_HIST ? MIN_VALUE_FOR_HIST : min);
        int maxBin = Math.max(LogBins.binOf(max), minBin);
        double step = (double) (maxBin - minBin) / bucketCount;

        List<Bucket> buckets = new ArrayList<>();
        double bottom = min;
        int previousBin = Integer.MIN_VALUE;
        for (int k = 1; k <= bucketCount; k++) {
            int bin = (int) Math.round(minBin + k * step);
            if (bin == previousBin) {
                continue;
            }
            double top = LogBins.binTop(bin);
            buckets.add(new Bucket(bin, bottom, top, ValueLabels.format((bottom + top) / 2, unit)));
            bottom = top;
            previousBin = bin;
        }

        logger.debug("Histogram over [{}, {}] -> bins {}..{} in {} buckets", min, max, minBin, maxBin, buckets.size());
        return buckets;
    }

    /**
     * Convert a series of sample percentages (0-100) into sample counts.
     *
     * @param percentages      share of samples per timestamp, as returned by a percentile-rank query
     * @param totalSampleCount samples over the whole window
     * @return series of rounded counts with unit {@value #COUNT_UNIT}
     */
    public Timeseries toCounts(Timeseries percentages, double totalSampleCount) {
        Timeseries.Builder counts = Timeseries.builder(percentages.label()).unit(COUNT_UNIT);
        for (int i = 0; i < percentages.size(); i++) {
            double percent = percentages.values().get(i);
            counts.add(percentages.timestamps().get(i), Math.round(percent * totalSampleCount / 100));
        }
        return counts.build();
    }
}
