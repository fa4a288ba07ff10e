package io.github.cyfko.celldl.core.lexer;

/**
 * Immutable lexical token.
 *
 * @param kind   token kind
 * @param image  exact source text of the token (string literals keep their quotes)
 * @param line   1-based line of the first character
 * @param column 1-based column of the first character
 * @param offset 0-based character offset of the first character
 * @param length number of characters covered
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenKind kind, String image, int line, int column, int offset, int length) {

    public int endOffset() {
        return offset + length;
    }

    public int endColumn() {
        return column + length;
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + "('" + image + "')@" + line + ":" + column;
    }
}
