package io.fullerstack.connector.cloudwatch.fetch;

import java.util.List;

/**
 * Reads raw samples from the metric backend.
 * <p>
 * Implementations hold no state between calls and may be used from several threads.
 */
public interface MetricFetcher {

    /**
     * Run all {@code queries} against {@code region} over {@code [startTime, endTime)}.
     *
     * @param region    backend region, e.g. {@code us-east-1}
     * @param startTime inclusive start, epoch seconds
     * @param endTime   exclusive end, epoch seconds
     * @param queries   queries with unique ids
     * @return series matched back to their query ids, timestamps ascending
     * @throws MetricFetchException if the backend call fails
     */
    MetricDataResponse fetch(String region, long startTime, long endTime, List<SeriesRequest> queries);
}
