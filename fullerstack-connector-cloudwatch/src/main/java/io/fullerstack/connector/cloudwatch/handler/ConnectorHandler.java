package io.fullerstack.connector.cloudwatch.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fullerstack.connector.cloudwatch.config.ConnectorConfig;
import io.fullerstack.connector.cloudwatch.config.Connectors;
import io.fullerstack.connector.cloudwatch.connector.ConnectorDescription;
import io.fullerstack.connector.cloudwatch.connector.ConnectorResult;
import io.fullerstack.connector.cloudwatch.connector.MetricDataConnector;
import io.fullerstack.connector.cloudwatch.connector.MetricDataRequest;
import io.fullerstack.connector.core.args.Argument;
import io.fullerstack.connector.core.error.ConnectorException;
import io.fullerstack.connector.core.error.ErrorCategory;
import io.fullerstack.connector.core.error.ValidationException;
import io.fullerstack.connector.core.model.QueryWindow;
import io.fullerstack.connector.core.model.Timeseries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON entry point: decodes an invocation event, dispatches it to the connector and
 * encodes the response.
 * <p>
 * Request:
 * <pre>
 * {"EventType": "GetMetricData", "region": "us-east-1",
 *  "GetMetricDataRequest": {"StartTime": 1000, "EndTime": 1600, "Period": 60, "Arguments": ["label", 10]}}
 * </pre>
 * Responses are either {@code {"MetricDataResults": [...]}}, the describe payload, or
 * {@code {"Error": {"Code": "Validation" | "InternalError", "Value": message}}}.
 *
 * @author Fullerstack
 */
public class ConnectorHandler {

    private static final Logger logger = LoggerFactory.getLogger(ConnectorHandler.class);

    private final MetricDataConnector connector;
    private final String defaultRegion;
    private final ObjectMapper objectMapper;

    /**
     * @param connector     connector answering every invocation
     * @param defaultRegion region used when an event carries none
     */
    public ConnectorHandler(MetricDataConnector connector, String defaultRegion) {
        this.connector = Objects.requireNonNull(connector, "connector cannot be null");
        this.defaultRegion = Objects.requireNonNull(defaultRegion, "defaultRegion cannot be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Handler for the connector configured through environment variables.
     */
    public static ConnectorHandler fromEnvironment() {
        ConnectorConfig config = ConnectorConfig.fromEnvironment();
        logger.info("Serving {} connector as '{}' (default region {})",
            config.type().id(), config.functionName(), config.defaultRegion());
        return new ConnectorHandler(Connectors.create(config), config.defaultRegion());
    }

    /**
     * Stream variant used by the function runtime. Unparseable input is answered with a
     * validation failure rather than an exception.
     */
    public void handleRequest(InputStream input, OutputStream output) throws IOException {
        JsonNode response;
        try {
            response = handle(objectMapper.readTree(input));
        } catch (JsonProcessingException e) {
            logger.warn("Rejected malformed invocation event: {}", e.getOriginalMessage());
            response = error(ErrorCategory.VALIDATION, "Malformed invocation event: " + e.getOriginalMessage());
        }
        objectMapper.writeValue(output, response);
    }

    public JsonNode handle(JsonNode event) {
        try {
            String eventType = event == null ? "null" : event.path("EventType").asText("null");
            EventType type = EventType.fromWireName(eventType)
                .orElseThrow(() -> new ValidationException("Unknown EventType: " + eventType));
            logger.debug("Handling {} event", type.wireName());

            return switch (type) {
                case GET_METRIC_DATA -> toJson(connector.getMetricData(parseRequest(event)));
                case DESCRIBE_GET_METRIC_DATA -> toJson(connector.describe());
            };
        } catch (ConnectorException e) {
            logger.warn("Rejected invocation event: {}", e.getMessage());
            return error(e.category(), e.getMessage());
        }
    }

    MetricDataRequest parseRequest(JsonNode event) {
        JsonNode body = event.path("GetMetricDataRequest");
        if (!body.isObject()) {
            throw new ValidationException("Missing GetMetricDataRequest");
        }
        QueryWindow window = new QueryWindow(
            requireNumber(body, "StartTime"),
            requireNumber(body, "EndTime"),
            requirePeriod(body));

        String region = event.path("region").asText("");
        return new MetricDataRequest(
            window,
            parseArguments(body.path("Arguments")),
            region.isBlank() ? defaultRegion : region);
    }

    private static long requireNumber(JsonNode body, String field) {
        JsonNode node = body.path(field);
        if (!node.isNumber()) {
            throw new ValidationException("Missing or non-numeric " + field);
        }
        return node.asLong();
    }

    private static int requirePeriod(JsonNode body) {
        long period = requireNumber(body, "Period");
        if (period <= 0 || period > Integer.MAX_VALUE) {
            throw new ValidationException("Period must be between 1 and " + Integer.MAX_VALUE + ", received " + period);
        }
        return (int) period;
    }

    private static List<Argument> parseArguments(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ValidationException("Arguments must be an array");
        }
        List<Argument> arguments = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            if (element.isTextual()) {
                arguments.add(Argument.of(element.asText()));
            } else if (element.isNumber()) {
                arguments.add(Argument.of(element.doubleValue()));
            } else {
                throw new ValidationException("Unsupported type for argument " + (i + 1) + ", expected string or number");
            }
        }
        return arguments;
    }

    private JsonNode toJson(ConnectorResult result) {
        if (result instanceof ConnectorResult.Failure failure) {
            return error(failure.category(), failure.message());
        }
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode results = root.putArray("MetricDataResults");
        for (Timeseries series : ((ConnectorResult.Success) result).series()) {
            ObjectNode node = results.addObject();
            node.put("StatusCode", series.status().code());
            node.put("Label", series.label());
            ArrayNode timestamps = node.putArray("Timestamps");
            for (long timestamp : series.timestamps()) {
                timestamps.add(timestamp);
            }
            ArrayNode values = node.putArray("Values");
            for (double value : series.values()) {
                values.add(value);
            }
            if (series.unit() != null) {
                node.put("Unit", series.unit());
            }
        }
        return root;
    }

    private JsonNode toJson(ConnectorDescription description) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("DataSourceConnectorName", description.name());
        ArrayNode defaults = root.putArray("ArgumentDefaults");
        for (Argument argument : description.argumentDefaults()) {
            ObjectNode value = defaults.addObject();
            if (argument instanceof Argument.NumberArgument number) {
                double n = number.value();
                if (n == Math.rint(n) && !Double.isInfinite(n)) {
                    value.put("Value", (long) n);
                } else {
                    value.put("Value", n);
                }
            } else {
                value.put("Value", argument.asString());
            }
        }
        root.put("Description", description.description());
        return root;
    }

    private JsonNode error(ErrorCategory category, String message) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode error = root.putObject("Error");
        error.put("Code", category.code());
        error.put("Value", message);
        return root;
    }
}
