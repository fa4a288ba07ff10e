package io.github.cyfko.celldl.core.model;

import io.github.cyfko.celldl.core.ast.Program;

import java.util.List;

/**
 * Outcome of a strict parse. The AST is present exactly when there are no errors.
 *
 * @param ast     program, {@code null} when {@code errors} is not empty
 * @param errors  errors in source order
 * @param success {@code true} when there are no errors
 */
public record ParseResult(Program ast, List<ParseError> errors, boolean success) {

    public ParseResult {
        errors = List.copyOf(errors);
        if (success != errors.isEmpty() || (ast == null) == success) {
            throw new IllegalArgumentException("A parse result has an AST exactly when it has no errors");
        }
    }

    public static ParseResult success(Program ast) {
        return new ParseResult(ast, List.of(), true);
    }

    public static ParseResult failure(List<ParseError> errors) {
        return new ParseResult(null, errors, false);
    }
}
