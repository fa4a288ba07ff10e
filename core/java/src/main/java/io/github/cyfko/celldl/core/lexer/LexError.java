package io.github.cyfko.celldl.core.lexer;

import io.github.cyfko.celldl.core.diagnostics.ErrorCode;

/**
 * Lexical error recorded by the {@link Lexer}. Lexical errors never stop tokenization.
 *
 * @param code    one of the 1xxx codes
 * @param message human readable description
 * @param line    1-based line
 * @param column  1-based column
 * @param offset  0-based character offset
 * @param length  number of characters covered
 */
public record LexError(ErrorCode code, String message, int line, int column, int offset, int length) {
}
