package io.fullerstack.connector.core.args;

import io.fullerstack.connector.core.error.ValidationException;

import java.util.Objects;

/**
 * One positional connector argument: either a string or a number.
 */
public sealed interface Argument permits Argument.StringArgument, Argument.NumberArgument {

    ArgumentKind kind();

    /**
     * Raw value as a string or a {@link Double}, for serialization.
     */
    Object value();

    static Argument of(String value) {
        return new StringArgument(value);
    }

    static Argument of(double value) {
        return new NumberArgument(value);
    }

    default String asString() {
        if (this instanceof StringArgument s) {
            return s.value();
        }
        throw new ValidationException("Expected a string argument, received " + value());
    }

    default double asNumber() {
        if (this instanceof NumberArgument n) {
            return n.value();
        }
        throw new ValidationException("Expected a number argument, received '" + value() + "'");
    }

    /**
     * Integer view of a number argument, or of a string holding an integer.
     *
     * @throws ValidationException if the value is not a whole number within {@code int} range
     */
    default int asInteger() {
        double number;
        if (this instanceof NumberArgument n) {
            number = n.value();
        } else {
            String text = ((StringArgument) this).value().trim();
            try {
                number = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new ValidationException("Expected an integer argument, received '" + text + "'", e);
            }
        }
        if (number != Math.rint(number) || number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            throw new ValidationException("Expected an integer argument, received '" + value() + "'");
        }
        return (int) number;
    }

    record StringArgument(String value) implements Argument {
        public StringArgument {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public ArgumentKind kind() {
            return ArgumentKind.STRING;
        }
    }

    record NumberArgument(Double value) implements Argument {
        public NumberArgument {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public ArgumentKind kind() {
            return ArgumentKind.NUMBER;
        }
    }
}
