package io.github.cyfko.celldl.core.ast;

/**
 * Interaction style a gateway exposes or an external system provides.
 */
public enum EndpointType implements DslKeyword {
    API("api"),
    EVENTS("events"),
    STREAM("stream");

    private final String keyword;

    EndpointType(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    /** @return the constant spelled {@code keyword}, or {@code null} */
    public static EndpointType fromKeyword(String keyword) {
        return DslKeyword.lookup(EndpointType.class, keyword);
    }
}
