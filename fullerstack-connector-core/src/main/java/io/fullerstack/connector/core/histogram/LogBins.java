package io.fullerstack.connector.core.histogram;

/**
 * Logarithmic value-to-bin mapping with a constant relative bin width.
 * <p>
 * Adjacent bins differ by a factor of {@code 1 + EPSILON}, i.e. each bin is about 10%
 * wider than the one below it, which draws as evenly sized bars on a log axis.
 * <p>
 * Bin layout:
 * <ul>
 *   <li>positive values: {@code floor(ln(v) / BIN_SIZE)}, saturated to
 *       {@code [-MAX_BIN_RANGE, MAX_BIN_RANGE]}</li>
 *   <li>zero: the single bin {@link #ZERO_VALUE_BIN}, just below the positive range</li>
 *   <li>negative values: the positive bin of {@code |v|} mirrored through
 *       {@link #NEGATIVE_ONE_BIN_OFFSET}, landing below the zero bin</li>
 * </ul>
 * The mapping is monotonic over the whole real line and never produces an infinite bin.
 */
public final class LogBins {

    public static final double EPSILON = 0.1;
    public static final double BIN_SIZE = Math.log(1 + EPSILON);
    public static final int MAX_BIN_RANGE = 7000;
    public static final int MIN_BIN_RANGE = -MAX_BIN_RANGE;
    public static final int ZERO_VALUE_BIN = MIN_BIN_RANGE - 1;
    public static final int NEGATIVE_ONE_BIN_OFFSET = -2 * MAX_BIN_RANGE - 2;
    /** Highest bin number used by negative values. */
    public static final int SMALLEST_BIN = NEGATIVE_ONE_BIN_OFFSET + MAX_BIN_RANGE;

    private LogBins() {}

    /**
     * Bin holding {@code value}.
     *
     * @throws IllegalArgumentException for NaN
     */
    public static int binOf(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Cannot bin NaN");
        }
        if (value == 0.0) {
            return ZERO_VALUE_BIN;
        }
        int bin = constrain(Math.floor(Math.log(Math.abs(value)) / BIN_SIZE));
        return value > 0.0 ? bin : NEGATIVE_ONE_BIN_OFFSET - bin;
    }

    /**
     * Value at {@code offset} bins past the lower edge of {@code bin}, sign restored.
     * An offset of 0 gives the lower edge of a positive bin.
     */
    public static double valueWithinBin(int bin, double offset) {
        if (bin == ZERO_VALUE_BIN) {
            return 0.0;
        }
        int magnitudeBin = bin;
        double sign = 1.0;
        if (magnitudeBin <= SMALLEST_BIN) {
            magnitudeBin = NEGATIVE_ONE_BIN_OFFSET - magnitudeBin;
            sign = -1.0;
        }
        magnitudeBin = constrain(magnitudeBin);
        return sign * Math.exp((magnitudeBin + offset) * BIN_SIZE);
    }

    /**
     * Upper edge of {@code bin}.
     */
    public static double binTop(int bin) {
        return valueWithinBin(bin + 1, 0);
    }

    private static int constrain(double bin) {
        if (bin > MAX_BIN_RANGE) {
            return MAX_BIN_RANGE;
        }
        if (bin < MIN_BIN_RANGE) {
            return MIN_BIN_RANGE;
        }
        return (int) bin;
    }
}
