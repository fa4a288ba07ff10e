package io.github.cyfko.celldl.core.ast;

/**
 * Single-line source span: 1-based line and column, 0-based offset.
 */
public record SourceLocation(int line, int column, int offset, int length) {

    /** Location used when nothing better is known. */
    public static final SourceLocation START = new SourceLocation(1, 1, 0, 1);

    public int endColumn() {
        return column + length;
    }
}
