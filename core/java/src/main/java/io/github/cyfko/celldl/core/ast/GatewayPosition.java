package io.github.cyfko.celldl.core.ast;

/**
 * Side of the cell a gateway is drawn on.
 */
public enum GatewayPosition implements DslKeyword {
    NORTH("north"),
    SOUTH("south"),
    EAST("east"),
    WEST("west");

    private final String keyword;

    GatewayPosition(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    /** @return the constant spelled {@code keyword}, or {@code null} */
    public static GatewayPosition fromKeyword(String keyword) {
        return DslKeyword.lookup(GatewayPosition.class, keyword);
    }
}
