package io.fullerstack.connector.core.args;

/**
 * Kind of value a connector expects at an argument position.
 */
public enum ArgumentKind {

    STRING("<string>"),
    NUMBER("<number>"),
    /** Either a number or a string that the connector converts itself. */
    ANY("<number|string>");

    private final String placeholder;

    ArgumentKind(String placeholder) {
        this.placeholder = placeholder;
    }

    public String placeholder() {
        return placeholder;
    }

    public boolean accepts(Argument argument) {
        return this == ANY || argument.kind() == this;
    }
}
