package io.fullerstack.connector.core.model;

import io.fullerstack.connector.core.error.ValidationException;

/**
 * Half-open query window {@code [startTime, endTime)} sampled every {@code period} seconds.
 * <p>
 * Samples are expected, not guaranteed, at every grid timestamp inside the window.
 *
 * @param startTime inclusive start, epoch seconds
 * @param endTime   exclusive end, epoch seconds
 * @param period    sampling period in seconds
 */
public record QueryWindow(long startTime, long endTime, int period) {

    public QueryWindow {
        if (period <= 0) {
            throw new ValidationException("Period must be positive, received " + period);
        }
        if (endTime <= startTime) {
            throw new ValidationException(
                "EndTime (" + endTime + ") must be after StartTime (" + startTime + ")");
        }
    }

    public boolean contains(long timestamp) {
        return timestamp >= startTime && timestamp < endTime;
    }

    /**
     * Seconds covered by the window.
     */
    public long range() {
        return endTime - startTime;
    }
}
