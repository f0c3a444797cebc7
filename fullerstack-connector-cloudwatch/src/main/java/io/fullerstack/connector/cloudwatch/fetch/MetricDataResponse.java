package io.fullerstack.connector.cloudwatch.fetch;

import io.fullerstack.connector.core.model.Timeseries;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Series returned for one fetch, grouped by query id.
 * <p>
 * A metric query yields one series; a search expression may yield several
 * under the same id.
 */
public final class MetricDataResponse {

    private final List<Result> results;

    public MetricDataResponse(List<Result> results) {
        this.results = List.copyOf(Objects.requireNonNull(results, "results cannot be null"));
    }

    public static MetricDataResponse empty() {
        return new MetricDataResponse(List.of());
    }

    /**
     * All series in backend order.
     */
    public List<Timeseries> all() {
        return results.stream().map(Result::series).toList();
    }

    public List<Timeseries> byId(String id) {
        return results.stream()
            .filter(r -> r.id().equals(id))
            .map(Result::series)
            .toList();
    }

    /**
     * First series for {@code id}, if the backend returned any.
     */
    public Optional<Timeseries> first(String id) {
        return results.stream()
            .filter(r -> r.id().equals(id))
            .map(Result::series)
            .findFirst();
    }

    public int size() {
        return results.size();
    }

    /**
     * A series together with the id of the query that produced it.
     */
    public record Result(String id, Timeseries series) {
        public Result {
            Objects.requireNonNull(id, "id cannot be null");
            Objects.requireNonNull(series, "series cannot be null");
        }
    }
}
