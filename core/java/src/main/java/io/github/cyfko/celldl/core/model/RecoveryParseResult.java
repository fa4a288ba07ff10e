package io.github.cyfko.celldl.core.model;

import io.github.cyfko.celldl.core.ast.Program;
import io.github.cyfko.celldl.core.diagnostics.EnhancedParseError;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a tolerant parse. The AST is always present.
 *
 * @param ast            program, possibly holding error placeholders
 * @param errors         diagnostics, deduplicated and sorted
 * @param success        {@code true} when there are no diagnostics at all
 * @param isComplete     {@code true} when the AST holds no error placeholder
 * @param errorNodeCount number of error placeholders in the AST
 */
public record RecoveryParseResult(
        Program ast,
        List<EnhancedParseError> errors,
        boolean success,
        boolean isComplete,
        int errorNodeCount
) {

    public RecoveryParseResult {
        Objects.requireNonNull(ast, "ast");
        errors = List.copyOf(errors);
    }

    public static RecoveryParseResult of(Program ast, List<EnhancedParseError> errors, int errorNodeCount) {
        return new RecoveryParseResult(ast, errors, errors.isEmpty(), errorNodeCount == 0, errorNodeCount);
    }
}
