package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.cloudwatch.fetch.MetricFetcher;
import io.fullerstack.connector.cloudwatch.fetch.SeriesRequest;
import io.fullerstack.connector.core.args.Argument;
import io.fullerstack.connector.core.args.ArgumentKind;
import io.fullerstack.connector.core.args.ArgumentSchema;
import io.fullerstack.connector.core.error.ValidationException;
import io.fullerstack.connector.core.metric.MetricName;
import io.fullerstack.connector.core.model.QueryWindow;
import io.fullerstack.connector.core.model.Timeseries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads the same metric from several regions concurrently, one series per region.
 * <p>
 * Each invocation gets its own executor, shut down before returning. Every region's fetch
 * runs to completion before results are read back in the order the regions were listed.
 * If any region fails the whole invocation fails with the failure of the first such region
 * in list order; partial results are dropped.
 */
public class MultiRegionConnector extends AbstractMetricDataConnector {

    private static final Logger logger = LoggerFactory.getLogger(MultiRegionConnector.class);

    private static final ArgumentSchema SCHEMA =
        ArgumentSchema.of(ArgumentKind.STRING, ArgumentKind.STRING, ArgumentKind.STRING);

    private final MetricFetcher fetcher;
    private final int maxParallelism;

    public MultiRegionConnector(String name, MetricFetcher fetcher, int maxParallelism) {
        super(name);
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("maxParallelism must be at least 1: " + maxParallelism);
        }
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
        this.maxParallelism = maxParallelism;
    }

    @Override
    public ConnectorDescription describe() {
        return new ConnectorDescription(
            name(),
            List.of(
                Argument.of("AWS/Usage, CallCount, Type, API, Resource, GetMetricData, Service, CloudWatch, Class, None"),
                Argument.of("Sum"),
                Argument.of("us-east-1, eu-west-1")),
            """
            ## Multi-region connector
            Loads one metric from each listed region, labelled with the region name.
            Useful to alarm on a metric of another region or on a combination across regions.

            Arguments: `(metric: string, stat: string, regions: comma separated string)`

            `LAMBDA('%s', 'AWS/Usage, CallCount, Type, API, Resource, GetMetricData, Service, CloudWatch, Class, None', 'Sum', 'us-east-1, eu-west-1')`
            """.formatted(name()));
    }

    @Override
    protected ArgumentSchema schema() {
        return SCHEMA;
    }

    @Override
    protected List<Timeseries> compute(MetricDataRequest request) {
        MetricName metric = MetricName.parse(request.argument(0).asString());
        String stat = request.argument(1).asString();
        List<String> regions = parseRegions(request.argument(2).asString());
        QueryWindow window = request.window();

        ExecutorService executor = newExecutor(Math.min(regions.size(), maxParallelism));
        try {
            List<CompletableFuture<Timeseries>> pending = new ArrayList<>(regions.size());
            for (String region : regions) {
                pending.add(CompletableFuture.supplyAsync(() -> fetchRegion(region, metric, stat, window), executor));
            }

            // Failures surface from the per-region joins below
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .exceptionally(e -> null)
                .join();

            List<Timeseries> series = new ArrayList<>(regions.size());
            for (CompletableFuture<Timeseries> future : pending) {
                series.add(join(future));
            }
            return series;
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Split a comma separated region list, dropping blank entries.
     *
     * @throws ValidationException if no region remains
     */
    static List<String> parseRegions(String text) {
        List<String> regions = Arrays.stream(text.split(","))
            .map(String::trim)
            .filter(region -> !region.isEmpty())
            .toList();
        if (regions.isEmpty()) {
            throw new ValidationException("Expected at least one region");
        }
        return regions;
    }

    /**
     * Query id for a region; ids may not contain hyphens.
     */
    static String queryId(String region) {
        return region.replace('-', '_');
    }

    private Timeseries fetchRegion(String region, MetricName metric, String stat, QueryWindow window) {
        String id = queryId(region);
        logger.debug("Fetching {} {} from {}", metric, stat, region);
        return fetcher.fetch(region, window.startTime(), window.endTime(),
                List.of(SeriesRequest.metricStat(id, metric, stat, window.period())))
            .first(id)
            .map(series -> series.withLabel(region))
            .orElseGet(() -> Timeseries.empty(region));
    }

    private static Timeseries join(CompletableFuture<Timeseries> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static ExecutorService newExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "multi-region-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
