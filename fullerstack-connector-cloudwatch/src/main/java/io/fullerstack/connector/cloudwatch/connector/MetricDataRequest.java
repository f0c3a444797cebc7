package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.core.args.Argument;
import io.fullerstack.connector.core.model.QueryWindow;

import java.util.List;
import java.util.Objects;

/**
 * One compute invocation.
 *
 * @param window    query window and period
 * @param arguments positional arguments as typed by the user
 * @param region    region the invocation runs in; default target of single-region fetches
 */
public record MetricDataRequest(QueryWindow window, List<Argument> arguments, String region) {

    public MetricDataRequest {
        Objects.requireNonNull(window, "window cannot be null");
        Objects.requireNonNull(region, "region cannot be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public Argument argument(int position) {
        return arguments.get(position);
    }

    public boolean hasArgument(int position) {
        return position < arguments.size();
    }
}
