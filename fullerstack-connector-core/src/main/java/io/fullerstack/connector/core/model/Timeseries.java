package io.fullerstack.connector.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A discretely sampled series on an implicit fixed step.
 * <p>
 * {@code values.get(i)} belongs to {@code timestamps.get(i)}. Timestamps are epoch
 * seconds in strictly increasing order; a missing step is a gap ("no sample"),
 * never a zero.
 *
 * @param label      display label
 * @param timestamps epoch-second timestamps, strictly increasing
 * @param values     sample values, index-aligned with {@code timestamps}
 * @param status     completion status for the returned range
 * @param unit       optional unit (null when the series carries none)
 * @author Fullerstack
 */
public record Timeseries(
    String label,
    List<Long> timestamps,
    List<Double> values,
    SeriesStatus status,
    String unit
) {

    /**
     * Compact constructor with validation.
     */
    public Timeseries {
        Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(timestamps, "timestamps cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        Objects.requireNonNull(status, "status cannot be null");

        if (timestamps.size() != values.size()) {
            throw new IllegalArgumentException(
                "timestamps and values must have the same length: " + timestamps.size() + " != " + values.size());
        }
        timestamps = List.copyOf(timestamps);
        values = List.copyOf(values);

        for (int i = 1; i < timestamps.size(); i++) {
            if (timestamps.get(i) <= timestamps.get(i - 1)) {
                throw new IllegalArgumentException(
                    "timestamps must be strictly increasing at index " + i + ": " + timestamps.get(i));
            }
        }
    }

    /**
     * Complete series without a unit.
     */
    public static Timeseries of(String label, List<Long> timestamps, List<Double> values) {
        return new Timeseries(label, timestamps, values, SeriesStatus.COMPLETE, null);
    }

    public static Timeseries empty(String label) {
        return of(label, List.of(), List.of());
    }

    public static Builder builder(String label) {
        return new Builder(label);
    }

    public int size() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    public Timeseries withLabel(String newLabel) {
        return new Timeseries(newLabel, timestamps, values, status, unit);
    }

    public Timeseries withUnit(String newUnit) {
        return new Timeseries(label, timestamps, values, status, newUnit);
    }

    /**
     * Points of this series inside {@code [window.startTime(), window.endTime())}.
     */
    public Timeseries restrictTo(QueryWindow window) {
        Builder builder = builder(label).unit(unit);
        for (int i = 0; i < timestamps.size(); i++) {
            if (window.contains(timestamps.get(i))) {
                builder.add(timestamps.get(i), values.get(i));
            }
        }
        return builder.build();
    }

    /**
     * Accumulates points in timestamp order.
     */
    public static final class Builder {
        private final String label;
        private final List<Long> timestamps = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();
        private String unit;

        private Builder(String label) {
            this.label = label;
        }

        public Builder add(long timestamp, double value) {
            timestamps.add(timestamp);
            values.add(value);
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Timeseries build() {
            return new Timeseries(label, timestamps, values, SeriesStatus.COMPLETE, unit);
        }
    }
}
