package io.fullerstack.connector.cloudwatch.connector;

import io.fullerstack.connector.core.args.Argument;
import io.fullerstack.connector.core.args.ArgumentKind;
import io.fullerstack.connector.core.args.ArgumentSchema;
import io.fullerstack.connector.core.model.QueryWindow;
import io.fullerstack.connector.core.model.Timeseries;

import java.util.List;

/**
 * Emits a constant series at every period step of the window. Makes no backend call.
 */
public class EchoConnector extends AbstractMetricDataConnector {

    private static final ArgumentSchema SCHEMA = ArgumentSchema.of(ArgumentKind.STRING, ArgumentKind.NUMBER);

    public EchoConnector(String name) {
        super(name);
    }

    @Override
    public ConnectorDescription describe() {
        return new ConnectorDescription(
            name(),
            List.of(Argument.of("metricLabel"), Argument.of(10)),
            """
            ## Constant value connector
            Returns a series with the same value at every period of the query window.

            Arguments: `(label: string, value: number)`

            `LAMBDA('%s', 'metricLabel', 10)`
            """.formatted(name()));
    }

    @Override
    protected ArgumentSchema schema() {
        return SCHEMA;
    }

    @Override
    protected List<Timeseries> compute(MetricDataRequest request) {
        String label = request.argument(0).asString();
        double value = request.argument(1).asNumber();
        QueryWindow window = request.window();

        Timeseries.Builder series = Timeseries.builder(label);
        for (long t = window.startTime(); t < window.endTime(); t += window.period()) {
            series.add(t, value);
        }
        return List.of(series.build());
    }
}
