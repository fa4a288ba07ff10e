package io.github.cyfko.celldl.core.ast;

/**
 * Kind of actor using the system.
 */
public enum UserType implements DslKeyword {
    EXTERNAL("external"),
    INTERNAL("internal"),
    SYSTEM("system");

    private final String keyword;

    UserType(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    /** @return the constant spelled {@code keyword}, or {@code null} */
    public static UserType fromKeyword(String keyword) {
        return DslKeyword.lookup(UserType.class, keyword);
    }
}
