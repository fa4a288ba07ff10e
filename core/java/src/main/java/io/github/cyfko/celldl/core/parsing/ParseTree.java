package io.github.cyfko.celldl.core.parsing;

import io.github.cyfko.celldl.core.lexer.Token;

import java.util.List;

/**
 * Result of {@link GrammarParser#parse(List, boolean)}.
 *
 * @param root   CST root, always a {@link GrammarRule#PROGRAM} node
 * @param errors syntax errors in the order they were met
 * @param tokens the token stream the tree was built from
 */
public record ParseTree(CstNode root, List<SyntaxError> errors, List<Token> tokens) {

    public ParseTree {
        errors = List.copyOf(errors);
        tokens = List.copyOf(tokens);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
