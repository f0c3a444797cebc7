package io.fullerstack.connector.core.histogram;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Formats bucket values for display, scaling time units to a readable magnitude.
 * <p>
 * Millisecond and second values get {@code ms}/{@code s} suffixes. Three significant
 * digits are used for small magnitudes and six once the value reaches a million
 * milliseconds (or a thousand seconds) so that wide buckets stay distinguishable.
 */
public final class ValueLabels {

    private static final Pattern MILLIS = Pattern.compile("millis", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECONDS = Pattern.compile("^sec", Pattern.CASE_INSENSITIVE);

    private ValueLabels() {}

    /**
     * @param value value to render
     * @param unit  metric unit such as {@code Milliseconds} or {@code Seconds}; may be null
     */
    public static String format(double value, String unit) {
        if (unit != null && MILLIS.matcher(unit).find()) {
            if (value < 1000) {
                return toPrecision(value, 3) + "ms";
            }
            if (value < 1_000_000) {
                return toPrecision(value / 1000, 3) + "s";
            }
            return toPrecision(value / 1000, 6) + "s";
        }
        if (unit != null && SECONDS.matcher(unit).find()) {
            if (value < 1) {
                return toPrecision(value * 1000, 3) + "ms";
            }
            if (value < 1000) {
                return toPrecision(value, 3) + "s";
            }
            return toPrecision(value, 6) + "s";
        }
        return toPrecision(value, 6);
    }

    /**
     * Render {@code value} with exactly {@code digits} significant digits.
     * <p>
     * Plain notation is used for decimal exponents from -6 up to {@code digits - 1},
     * exponent notation ({@code 1.23e+7}) outside that range.
     */
    public static String toPrecision(double value, int digits) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == 0.0) {
            return digits == 1 ? "0" : "0." + "0".repeat(digits - 1);
        }
        BigDecimal rounded = new BigDecimal(value).round(new MathContext(digits, RoundingMode.HALF_UP));
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -6 || exponent >= digits) {
            String mantissa = rounded.movePointLeft(exponent).setScale(digits - 1).toPlainString();
            return mantissa + "e" + (exponent < 0 ? "-" : "+") + Math.abs(exponent);
        }
        return rounded.setScale(Math.max(0, digits - 1 - exponent)).toPlainString();
    }
}
