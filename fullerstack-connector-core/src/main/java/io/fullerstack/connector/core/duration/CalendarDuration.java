package io.fullerstack.connector.core.duration;

import io.fullerstack.connector.core.error.ValidationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Restricted ISO 8601 calendar durations: days, hours, minutes and seconds.
 * <p>
 * Accepted form is {@code P[nD][T][nH][nM][n[.fff]S]}, e.g. {@code P7D}, {@code PT3H},
 * {@code P1DT3H}, {@code PT1.5S}. Months and years are not supported since they have
 * no fixed length in seconds.
 */
public final class CalendarDuration {

    private static final Pattern DURATION_PATTERN =
        Pattern.compile("^P(?:(\\d+)D)?T*(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+(?:\\.\\d{1,3})?)S)?$");

    private static final long SECONDS_PER_DAY = 24 * 3600;

    private CalendarDuration() {}

    /**
     * Parse a duration string.
     *
     * @throws ValidationException if the text does not follow the grammar
     */
    public static Duration parse(String text) {
        Matcher matcher = text == null ? null : DURATION_PATTERN.matcher(text.trim());
        if (matcher == null || !matcher.matches()) {
            throw new ValidationException("Unrecognized ISO duration " + text);
        }
        try {
            Duration duration = Duration.ofDays(group(matcher, 1))
                .plusHours(group(matcher, 2))
                .plusMinutes(group(matcher, 3));
            String seconds = matcher.group(4);
            if (seconds != null) {
                long millis = new BigDecimal(seconds).movePointRight(3).longValueExact();
                duration = duration.plusMillis(millis);
            }
            return duration;
        } catch (ArithmeticException | NumberFormatException e) {
            throw new ValidationException("Unrecognized ISO duration " + text, e);
        }
    }

    /**
     * Parse a shift interval and return it in whole seconds.
     * <p>
     * Sub-second parts are dropped, so {@code PT0.5S} is rejected like {@code P0D}.
     *
     * @throws ValidationException if the text is malformed or the interval is not positive
     */
    public static long parsePositiveSeconds(String text) {
        long seconds = parse(text).toSeconds();
        if (seconds <= 0) {
            throw new ValidationException(
                "Illegal shift interval '" + text + "' specified, must be > 0 seconds");
        }
        return seconds;
    }

    /**
     * Render elapsed seconds as {@code 1d 3h 4m 5s}, leaving out zero parts.
     */
    public static String humanize(long seconds) {
        long days = seconds / SECONDS_PER_DAY;
        long hours = (seconds % SECONDS_PER_DAY) / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        StringJoiner parts = new StringJoiner(" ");
        if (days > 0) {
            parts.add(days + "d");
        }
        if (hours > 0) {
            parts.add(hours + "h");
        }
        if (minutes > 0) {
            parts.add(minutes + "m");
        }
        if (secs > 0) {
            parts.add(secs + "s");
        }
        return parts.toString();
    }

    private static long group(Matcher matcher, int index) {
        String value = matcher.group(index);
        return value == null ? 0 : Long.parseLong(value);
    }
}
