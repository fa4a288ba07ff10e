package io.github.cyfko.celldl.core.ast;

/**
 * How a gateway authenticates callers.
 */
public enum AuthType implements DslKeyword {
    LOCAL_STS("local-sts"),
    FEDERATED("federated");

    private final String keyword;

    AuthType(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    /** @return the constant spelled {@code keyword}, or {@code null} */
    public static AuthType fromKeyword(String keyword) {
        return DslKeyword.lookup(AuthType.class, keyword);
    }
}
