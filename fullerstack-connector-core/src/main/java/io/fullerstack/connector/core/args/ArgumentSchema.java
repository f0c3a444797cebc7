package io.fullerstack.connector.core.args;

import io.fullerstack.connector.core.error.ValidationException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered list of argument kinds a connector accepts.
 * <p>
 * The first {@code required} positions are mandatory, the rest optional. Count
 * and kinds are checked together at the start of an invocation, before any
 * backend call is made.
 *
 * @param kinds    expected kind per position
 * @param required number of leading mandatory arguments
 */
public record ArgumentSchema(List<ArgumentKind> kinds, int required) {

    public ArgumentSchema {
        Objects.requireNonNull(kinds, "kinds cannot be null");
        kinds = List.copyOf(kinds);
        if (required < 0 || required > kinds.size()) {
            throw new IllegalArgumentException("required must be between 0 and " + kinds.size());
        }
    }

    /**
     * Schema in which every argument is mandatory.
     */
    public static ArgumentSchema of(ArgumentKind... kinds) {
        return new ArgumentSchema(List.of(kinds), kinds.length);
    }

    /**
     * Schema whose arguments after the first {@code required} ones may be omitted.
     */
    public static ArgumentSchema withOptional(int required, ArgumentKind... kinds) {
        return new ArgumentSchema(List.of(kinds), required);
    }

    /**
     * Check argument count and kinds.
     *
     * @throws ValidationException on a wrong count or an unexpected kind
     */
    public void validate(List<Argument> arguments) {
        int count = arguments == null ? 0 : arguments.size();
        if (count < required || count > kinds.size()) {
            throw new ValidationException("Expected " + describeCount() + " arguments, received " + count);
        }
        for (int i = 0; i < count; i++) {
            if (!kinds.get(i).accepts(arguments.get(i))) {
                throw new ValidationException("Unexpected argument type, expected " + signature());
            }
        }
    }

    /**
     * Human readable signature, e.g. {@code (<string>, <string>[, <number>])}.
     */
    public String signature() {
        String mandatory = kinds.subList(0, required).stream()
            .map(ArgumentKind::placeholder)
            .collect(Collectors.joining(", "));
        StringBuilder signature = new StringBuilder("(").append(mandatory);
        for (int i = required; i < kinds.size(); i++) {
            signature.append(i == 0 ? "[" : "[, ").append(kinds.get(i).placeholder());
        }
        signature.append("]".repeat(kinds.size() - required));
        return signature.append(')').toString();
    }

    private String describeCount() {
        return required == kinds.size()
            ? String.valueOf(required)
            : required + " to " + kinds.size();
    }
}
