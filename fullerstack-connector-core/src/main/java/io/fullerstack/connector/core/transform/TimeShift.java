package io.fullerstack.connector.core.transform;

import io.fullerstack.connector.core.duration.CalendarDuration;
import io.fullerstack.connector.core.error.ValidationException;
import io.fullerstack.connector.core.model.QueryWindow;
import io.fullerstack.connector.core.model.Timeseries;
import io.fullerstack.connector.core.model.TimestampIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Overlays a series with copies of itself shifted back by whole multiples of an interval.
 * <p>
 * Produces {@code numberOfShifts + 1} series on the query grid: shift 0 labelled
 * {@code current}, then one series per multiple of the interval labelled with the
 * elapsed time, e.g. {@code - 7d}. Point {@code t} of shift {@code i} carries the raw
 * value recorded at {@code t - i * interval}; grid points whose historical instant
 * has no sample are skipped.
 * <p>
 * Lookups go by absolute timestamp rather than by index offset, so uneven sample
 * availability in the backend cannot misalign shifted series with the current one.
 */
public final class TimeShift {

    private static final Logger logger = LoggerFactory.getLogger(TimeShift.class);

    public static final int MIN_SHIFTS = 1;
    public static final int MAX_SHIFTS = 10;
    public static final String CURRENT_LABEL = "current";

    private final long shiftSeconds;
    private final int numberOfShifts;
    private final long lookbackSeconds;

    /**
     * @param shiftSeconds   shift interval in seconds, positive
     * @param numberOfShifts number of shifted copies, {@value #MIN_SHIFTS} to {@value #MAX_SHIFTS}
     * @throws ValidationException if either parameter is out of range
     */
    public TimeShift(long shiftSeconds, int numberOfShifts) {
        if (shiftSeconds <= 0) {
            throw new ValidationException("Shift interval must be > 0 seconds, received " + shiftSeconds);
        }
        if (numberOfShifts < MIN_SHIFTS || numberOfShifts > MAX_SHIFTS) {
            throw new ValidationException("Number of shifts, " + numberOfShifts
                + ", must be between " + MIN_SHIFTS + " and " + MAX_SHIFTS + " inclusive");
        }
        this.shiftSeconds = shiftSeconds;
        this.numberOfShifts = numberOfShifts;
        try {
            this.lookbackSeconds = Math.multiplyExact(shiftSeconds, (long) numberOfShifts);
        } catch (ArithmeticException e) {
            throw new ValidationException("Shift interval of " + shiftSeconds + "s repeated "
                + numberOfShifts + " times is out of range", e);
        }
    }

    public long shiftSeconds() {
        return shiftSeconds;
    }

    public int numberOfShifts() {
        return numberOfShifts;
    }

    /**
     * Earliest timestamp the raw series must cover so that the oldest shift is complete.
     *
     * @throws ValidationException if the oldest shift reaches before the earliest representable instant
     */
    public long fetchStart(QueryWindow window) {
        long start = window.startTime() - lookbackSeconds;
        if (start > window.startTime() || start < Instant.MIN.getEpochSecond()) {
            throw new ValidationException("Shifting StartTime " + window.startTime() + " back by "
                + lookbackSeconds + "s is out of range");
        }
        return start;
    }

    /**
     * Build the current series and every shifted copy, in shift order.
     */
    public List<Timeseries> apply(Timeseries raw, QueryWindow window) {
        TimestampIndex index = TimestampIndex.of(raw);
        List<Timeseries> shifted = new ArrayList<>(numberOfShifts + 1);

        for (int i = 0; i <= numberOfShifts; i++) {
            long offset = i * shiftSeconds;
            Timeseries.Builder series = Timeseries.builder(labelFor(offset)).unit(raw.unit());
            for (long time = window.startTime(); time < window.endTime(); time += window.period()) {
                OptionalDouble value = index.valueAt(time - offset);
                if (value.isPresent()) {
                    series.add(time, value.getAsDouble());
                }
            }
            shifted.add(series.build());
        }

        logger.debug("Time shifted '{}' {} times by {}s", raw.label(), numberOfShifts, shiftSeconds);
        return shifted;
    }

    static String labelFor(long offsetSeconds) {
        return offsetSeconds == 0 ? CURRENT_LABEL : "- " + CalendarDuration.humanize(offsetSeconds);
    }
}
