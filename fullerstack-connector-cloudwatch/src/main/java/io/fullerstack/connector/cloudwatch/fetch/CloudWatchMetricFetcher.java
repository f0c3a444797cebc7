package io.fullerstack.connector.cloudwatch.fetch;

import io.fullerstack.connector.core.metric.MetricName;
import io.fullerstack.connector.core.model.Timeseries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * {@link MetricFetcher} backed by the CloudWatch {@code GetMetricData} API.
 * <p>
 * A client is built for the requested region on every fetch and closed afterwards.
 * All result pages are read; pages of the same query id and label are merged and
 * their points sorted by timestamp.
 *
 * @author Fullerstack
 */
public class CloudWatchMetricFetcher implements MetricFetcher {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricFetcher.class);

    private final Function<String, CloudWatchClient> clientFactory;

    /**
     * Creates a fetcher using default credentials and the requested region.
     */
    public CloudWatchMetricFetcher() {
        this(region -> CloudWatchClient.builder()
            .region(Region.of(region))
            .build());
    }

    /**
     * @param clientFactory builds a CloudWatch client for a region name
     */
    public CloudWatchMetricFetcher(Function<String, CloudWatchClient> clientFactory) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory cannot be null");
    }

    @Override
    public MetricDataResponse fetch(String region, long startTime, long endTime, List<SeriesRequest> queries) {
        List<MetricDataQuery> dataQueries = queries.stream()
            .map(CloudWatchMetricFetcher::toDataQuery)
            .toList();
        logger.debug("Fetching {} queries from {} over [{}, {})", queries.size(), region, startTime, endTime);

        try (CloudWatchClient cloudWatch = clientFactory.apply(region)) {
            Map<String, PartialSeries> merged = new LinkedHashMap<>();
            String nextToken = null;
            int pages = 0;
            do {
                GetMetricDataResponse response = cloudWatch.getMetricData(GetMetricDataRequest.builder()
                    .metricDataQueries(dataQueries)
                    .startTime(Instant.ofEpochSecond(startTime))
                    .endTime(Instant.ofEpochSecond(endTime))
                    .scanBy(ScanBy.TIMESTAMP_ASCENDING)
                    .nextToken(nextToken)
                    .build());
                pages++;
                for (MetricDataResult result : response.metricDataResults()) {
                    String label = result.label() != null ? result.label() : result.id();
                    merged.computeIfAbsent(result.id() + '\n' + label, key -> new PartialSeries(result.id(), label))
                        .addAll(result.timestamps(), result.values());
                }
                nextToken = response.nextToken();
            } while (nextToken != null && !nextToken.isEmpty());

            List<MetricDataResponse.Result> results = new ArrayList<>(merged.size());
            merged.values().forEach(partial -> results.add(partial.toResult()));
            logger.debug("Fetched {} series in {} page(s) from {}", results.size(), pages, region);
            return new MetricDataResponse(results);

        } catch (CloudWatchException e) {
            if (e.awsErrorDetails() != null && "Throttling".equals(e.awsErrorDetails().errorCode())) {
                throw new MetricFetchException("CloudWatch API throttled in " + region + ", retry later", e);
            }
            throw new MetricFetchException("Failed to get metric data from " + region + ": " + e.getMessage(), e);
        } catch (Exception e) {
            throw new MetricFetchException("Failed to get metric data from " + region + ": " + e.getMessage(), e);
        }
    }

    static MetricDataQuery toDataQuery(SeriesRequest request) {
        MetricDataQuery.Builder query = MetricDataQuery.builder()
            .id(request.id())
            .label(request.label())
            .returnData(true);
        if (request.isExpression()) {
            return query.expression(request.expression())
                .period(request.period())
                .build();
        }
        return query.metricStat(MetricStat.builder()
                .metric(toMetric(request.metric()))
                .stat(request.stat())
                .period(request.period())
                .build())
            .build();
    }

    static Metric toMetric(MetricName name) {
        List<Dimension> dimensions = name.dimensions().stream()
            .map(d -> Dimension.builder().name(d.name()).value(d.value()).build())
            .toList();
        return Metric.builder()
            .namespace(name.namespace())
            .metricName(name.metricName())
            .dimensions(dimensions)
            .build();
    }

    /**
     * Points of one query id and label gathered across pages.
     */
    private static final class PartialSeries {
        private final String id;
        private final String label;
        private final TreeMap<Long, Double> points = new TreeMap<>();

        PartialSeries(String id, String label) {
            this.id = id;
            this.label = label;
        }

        void addAll(List<Instant> timestamps, List<Double> values) {
            int count = Math.min(timestamps.size(), values.size());
            for (int i = 0; i < count; i++) {
                points.put(Math.round(timestamps.get(i).toEpochMilli() / 1000.0), values.get(i));
            }
        }

        MetricDataResponse.Result toResult() {
            Timeseries.Builder builder = Timeseries.builder(label);
            points.forEach(builder::add);
            return new MetricDataResponse.Result(id, builder.build());
        }
    }
}
