package io.github.cyfko.celldl.core.ast;

/**
 * Kind of cell, which decides how the cell is drawn and what it may contain.
 */
public enum CellType implements DslKeyword {
    LOGIC("logic"),
    INTEGRATION("integration"),
    DATA("data"),
    SECURITY("security"),
    CHANNEL("channel"),
    LEGACY("legacy");

    private final String keyword;

    CellType(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    /** @return the constant spelled {@code keyword}, or {@code null} */
    public static CellType fromKeyword(String keyword) {
        return DslKeyword.lookup(CellType.class, keyword);
    }
}
