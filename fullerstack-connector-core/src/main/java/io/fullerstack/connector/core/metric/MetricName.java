package io.fullerstack.connector.core.metric;

import io.fullerstack.connector.core.error.ValidationException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fully qualified metric: namespace, metric name and dimensions.
 * <p>
 * Parsed from the single-string form used in connector arguments:
 * <pre>
 * AWS/Lambda,Duration,FunctionName,my-function
 * </pre>
 * Fields are comma separated and trimmed; each field is percent-decoded so that
 * commas and other reserved characters can appear in names and values.
 *
 * @param namespace  metric namespace, e.g. {@code AWS/Lambda}
 * @param metricName metric name, e.g. {@code Duration}
 * @param dimensions dimension pairs in argument order
 * @author Fullerstack
 */
public record MetricName(String namespace, String metricName, List<Dimension> dimensions) {

    static final String MALFORMED_MESSAGE =
        "Malformed full metric name, expected <Namespace>,<MetricName>,<DimPair Name 1>,<DimPair Value 1>,... etc";

    public MetricName {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(metricName, "metricName cannot be null");
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }

    /**
     * Parse the comma separated form.
     *
     * @throws ValidationException with fewer than two fields or an odd field count
     */
    public static MetricName parse(String fullMetricName) {
        if (fullMetricName == null) {
            throw new ValidationException(MALFORMED_MESSAGE);
        }
        List<String> fields = Arrays.stream(fullMetricName.split(",", -1))
            .map(String::trim)
            .toList();
        if (fields.size() < 2 || fields.size() % 2 != 0) {
            throw new ValidationException(MALFORMED_MESSAGE);
        }

        List<Dimension> dimensions = new ArrayList<>();
        for (int i = 2; i < fields.size() - 1; i += 2) {
            dimensions.add(new Dimension(decode(fields.get(i)), decode(fields.get(i + 1))));
        }
        return new MetricName(decode(fields.get(0)), decode(fields.get(1)), dimensions);
    }

    private static String decode(String field) {
        try {
            // '+' is a literal plus here, not an encoded space
            return URLDecoder.decode(field.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed percent-encoding in metric field '" + field + "'", e);
        }
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(namespace).append(',').append(metricName);
        dimensions.forEach(d -> text.append(',').append(d.name()).append(',').append(d.value()));
        return text.toString();
    }
}
