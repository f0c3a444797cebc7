package io.fullerstack.connector.core.transform;

import io.fullerstack.connector.core.error.ValidationException;
import io.fullerstack.connector.core.model.QueryWindow;
import io.fullerstack.connector.core.model.Timeseries;
import io.fullerstack.connector.core.model.TimestampIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalDouble;

/**
 * Trailing moving average over the last {@code N} grid slots.
 * <p>
 * Each output point is the mean of the samples present among the slot itself and
 * the {@code N - 1} slots before it. Missing samples are ignored rather than
 * counted as zero, and a slot whose whole window is empty produces no point.
 * <p>
 * To average the first points of the window the raw series must reach back
 * {@code (N - 1) * period} seconds before {@code startTime}; see
 * {@link #lookbackStart(QueryWindow)}.
 *
 * <pre>
 * MovingAverage average = new MovingAverage(10);
 * long from = average.lookbackStart(window);
 * Timeseries raw = ... // fetched over [from, window.endTime())
 * Timeseries smoothed = average.apply(raw, from, window);
 * </pre>
 *
 * @author Fullerstack
 */
public final class MovingAverage {

    private static final Logger logger = LoggerFactory.getLogger(MovingAverage.class);

    private final int windowLength;

    /**
     * @param windowLength number of grid slots per window, at least 2
     * @throws ValidationException if {@code windowLength < 2}
     */
    public MovingAverage(int windowLength) {
        if (windowLength < 2) {
            throw new ValidationException(
                "Number of datapoints, " + windowLength + ", must be greater than 1");
        }
        this.windowLength = windowLength;
    }

    public int windowLength() {
        return windowLength;
    }

    /**
     * Earliest timestamp needed to fill the first window of {@code window}.
     */
    public long lookbackStart(QueryWindow window) {
        return window.startTime() - (long) (windowLength - 1) * window.period();
    }

    /**
     * Average {@code raw} over the query window.
     * <p>
     * The walk starts at {@code anchor}, which should be the earliest grid timestamp
     * the backend actually covers for the lookback range. Starting there instead of
     * the theoretical lookback start keeps history the backend never returned from
     * being read as gaps.
     *
     * @param raw    samples covering the lookback range and the query window
     * @param anchor first grid timestamp of the walk
     * @param window query window; only points inside it are emitted
     * @return averaged series carrying the raw label and unit
     */
    public Timeseries apply(Timeseries raw, long anchor, QueryWindow window) {
        TimestampIndex index = TimestampIndex.of(raw);
        Timeseries.Builder averaged = Timeseries.builder(raw.label()).unit(raw.unit());

        Deque<OptionalDouble> slots = new ArrayDeque<>(windowLength + 1);
        int sampleCount = 0;
        double sampleSum = 0;

        for (long time = anchor; time < window.endTime(); time += window.period()) {
            OptionalDouble value = index.valueAt(time);
            slots.addLast(value);
            if (value.isPresent()) {
                sampleCount++;
                sampleSum += value.getAsDouble();
            }

            if (slots.size() > windowLength) {
                OptionalDouble evicted = slots.removeFirst();
                if (evicted.isPresent()) {
                    sampleCount--;
                    sampleSum -= evicted.getAsDouble();
                }
            }
            if (sampleCount == 0) {
                // drop accumulated rounding error once the window drains
                sampleSum = 0;
            }

            if (time >= window.startTime() && sampleCount > 0) {
                averaged.add(time, sampleSum / sampleCount);
            }
        }

        Timeseries result = averaged.build();
        logger.debug("Moving average of '{}' over {} slots: {} raw points -> {} points",
            raw.label(), windowLength, raw.size(), result.size());
        return result;
    }
}
