package io.github.cyfko.celldl.core.ast;

/**
 * Kind of system living outside the architecture.
 */
public enum ExternalType implements DslKeyword {
    SAAS("saas"),
    PARTNER("partner"),
    ENTERPRISE("enterprise");

    private final String keyword;

    ExternalType(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    /** @return the constant spelled {@code keyword}, or {@code null} */
    public static ExternalType fromKeyword(String keyword) {
        return DslKeyword.lookup(ExternalType.class, keyword);
    }
}
