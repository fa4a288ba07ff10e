package io.github.cyfko.celldl.core.ast;

/**
 * Direction of a connection relative to the cell boundary.
 */
public enum ConnectionDirection implements DslKeyword {
    NORTHBOUND("northbound"),
    SOUTHBOUND("southbound"),
    EASTBOUND("eastbound"),
    WESTBOUND("westbound");

    private final String keyword;

    ConnectionDirection(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    /** @return the constant spelled {@code keyword}, or {@code null} */
    public static ConnectionDirection fromKeyword(String keyword) {
        return DslKeyword.lookup(ConnectionDirection.class, keyword);
    }
}
