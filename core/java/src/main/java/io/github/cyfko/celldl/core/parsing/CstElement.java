package io.github.cyfko.celldl.core.parsing;

import io.github.cyfko.celldl.core.lexer.Token;

/**
 * Child slot content of a {@link CstNode}: either a nested node or a consumed token.
 */
public sealed interface CstElement permits CstNode, CstElement.Leaf {

    /** Earliest token in source order, or {@code null} when the element holds none. */
    Token firstToken();

    /**
     * Token leaf of the concrete syntax tree.
     *
     * @param token consumed token
     */
    record Leaf(Token token) implements CstElement {
        @Override
        public Token firstToken() {
            return token;
        }
    }
}
