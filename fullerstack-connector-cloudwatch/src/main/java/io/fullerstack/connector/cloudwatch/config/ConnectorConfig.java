package io.fullerstack.connector.cloudwatch.config;

import java.util.Map;
import java.util.Objects;

/**
 * Deployment configuration, read from environment variables.
 *
 * @param type           connector served by this deployment ({@code CONNECTOR_TYPE})
 * @param functionName   display name reported by describe ({@code AWS_LAMBDA_FUNCTION_NAME})
 * @param defaultRegion  region used when an invocation carries none ({@code AWS_REGION})
 * @param maxParallelism upper bound on concurrent region fetches ({@code MULTI_REGION_MAX_PARALLELISM})
 */
public record ConnectorConfig(
    ConnectorType type,
    String functionName,
    String defaultRegion,
    int maxParallelism
) {

    public static final String DEFAULT_FUNCTION_NAME = "metric-connector";
    public static final String DEFAULT_REGION = "us-east-1";
    public static final int DEFAULT_MAX_PARALLELISM = 10;

    public ConnectorConfig {
        Objects.requireNonNull(type, "type cannot be null");
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("functionName cannot be blank");
        }
        if (defaultRegion == null || defaultRegion.isBlank()) {
            throw new IllegalArgumentException("defaultRegion cannot be blank");
        }
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("maxParallelism must be at least 1, got: " + maxParallelism);
        }
    }

    public static ConnectorConfig defaults() {
        return new ConnectorConfig(ConnectorType.ECHO, DEFAULT_FUNCTION_NAME, DEFAULT_REGION, DEFAULT_MAX_PARALLELISM);
    }

    public static ConnectorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build from an environment map; absent variables take their defaults.
     *
     * @throws IllegalArgumentException for an unknown connector type or a non-numeric parallelism
     */
    public static ConnectorConfig fromEnvironment(Map<String, String> env) {
        ConnectorType type = ConnectorType.fromId(env.getOrDefault("CONNECTOR_TYPE", ConnectorType.ECHO.id()));

        String functionName = env.getOrDefault(
            "AWS_LAMBDA_FUNCTION_NAME",
            DEFAULT_FUNCTION_NAME
        );

        String region = env.getOrDefault(
            "AWS_REGION",
            DEFAULT_REGION
        );

        String parallelism = env.getOrDefault(
            "MULTI_REGION_MAX_PARALLELISM",
            String.valueOf(DEFAULT_MAX_PARALLELISM)
        );
        int maxParallelism;
        try {
            maxParallelism = Integer.parseInt(parallelism.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("MULTI_REGION_MAX_PARALLELISM must be an integer, got: " + parallelism, e);
        }

        return new ConnectorConfig(type, functionName, region, maxParallelism);
    }
}
