package io.fullerstack.connector.cloudwatch.handler;

import java.util.Arrays;
import java.util.Optional;

/**
 * Invocation kinds sent by the console.
 */
public enum EventType {

    GET_METRIC_DATA("GetMetricData"),
    DESCRIBE_GET_METRIC_DATA("DescribeGetMetricData");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<EventType> fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(wireName))
            .findFirst();
    }
}
