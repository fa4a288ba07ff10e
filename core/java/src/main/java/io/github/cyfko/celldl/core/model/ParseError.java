package io.github.cyfko.celldl.core.model;

import io.github.cyfko.celldl.core.diagnostics.EnhancedParseError;

/**
 * Minimal error description returned by the strict entry points.
 *
 * @param message human message
 * @param line    1-based line
 * @param column  1-based column
 * @param offset  0-based offset
 * @param length  span length
 */
public record ParseError(String message, int line, int column, int offset, int length) {

    public static ParseError from(EnhancedParseError error) {
        return new ParseError(error.message(), error.line(), error.column(), error.offset(), error.length());
    }
}
