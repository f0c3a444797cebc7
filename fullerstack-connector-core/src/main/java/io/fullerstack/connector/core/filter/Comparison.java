package io.fullerstack.connector.core.filter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators accepted in filter expressions.
 */
public enum Comparison {

    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<Comparison> fromSymbol(String symbol) {
        return Arrays.stream(values())
            .filter(c -> c.symbol.equals(symbol))
            .findFirst();
    }

    public boolean test(double stat, double threshold) {
        return switch (this) {
            case GREATER_THAN -> stat > threshold;
            case GREATER_OR_EQUAL -> stat >= threshold;
            case LESS_THAN -> stat < threshold;
            case LESS_OR_EQUAL -> stat <= threshold;
            case EQUAL -> stat == threshold;
            case NOT_EQUAL -> stat != threshold;
        };
    }
}
