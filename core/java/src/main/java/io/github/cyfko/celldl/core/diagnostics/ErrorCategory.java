package io.github.cyfko.celldl.core.diagnostics;

/**
 * Category of a diagnostic, derived from the thousands digit of its {@link ErrorCode}.
 */
public enum ErrorCategory {
    LEXICAL,
    STRUCTURAL,
    SYNTACTIC,
    SEMANTIC
}
