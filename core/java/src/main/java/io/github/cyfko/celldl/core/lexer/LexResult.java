package io.github.cyfko.celldl.core.lexer;

import java.util.List;

/**
 * Outcome of {@link Lexer#tokenize(String)}: the token stream (never {@code null}) and
 * the lexical errors met while producing it.
 *
 * @param tokens significant tokens in source order, without an end-of-input marker
 * @param errors lexical errors in source order
 */
public record LexResult(List<Token> tokens, List<LexError> errors) {

    public LexResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
