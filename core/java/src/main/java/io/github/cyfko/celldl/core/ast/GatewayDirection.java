package io.github.cyfko.celldl.core.ast;

/**
 * Traffic direction handled by a gateway.
 */
public enum GatewayDirection implements DslKeyword {
    INGRESS("ingress"),
    EGRESS("egress");

    private final String keyword;

    GatewayDirection(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    /** @return the constant spelled {@code keyword}, or {@code null} */
    public static GatewayDirection fromKeyword(String keyword) {
        return DslKeyword.lookup(GatewayDirection.class, keyword);
    }
}
