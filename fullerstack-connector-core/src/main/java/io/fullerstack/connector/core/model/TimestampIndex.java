package io.fullerstack.connector.core.model;

import java.util.NavigableMap;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Lookup of sample values by exact epoch-second timestamp.
 * <p>
 * Keys are integer seconds so that lookups never miss on floating-point noise.
 * A gap yields an empty result rather than a synthesized zero. Should a series
 * contain a duplicate timestamp the last value wins.
 */
public final class TimestampIndex {

    private final NavigableMap<Long, Double> valuesByTimestamp;

    private TimestampIndex(NavigableMap<Long, Double> valuesByTimestamp) {
        this.valuesByTimestamp = valuesByTimestamp;
    }

    public static TimestampIndex of(Timeseries series) {
        NavigableMap<Long, Double> map = new TreeMap<>();
        for (int i = 0; i < series.size(); i++) {
            map.put(series.timestamps().get(i), series.values().get(i));
        }
        return new TimestampIndex(map);
    }

    public OptionalDouble valueAt(long timestamp) {
        Double value = valuesByTimestamp.get(timestamp);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public OptionalLong earliest() {
        return valuesByTimestamp.isEmpty()
            ? OptionalLong.empty()
            : OptionalLong.of(valuesByTimestamp.firstKey());
    }

    public int size() {
        return valuesByTimestamp.size();
    }
}
