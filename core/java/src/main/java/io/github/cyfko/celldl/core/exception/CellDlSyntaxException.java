package io.github.cyfko.celldl.core.exception;

import io.github.cyfko.celldl.core.api.CellDlParser;
import io.github.cyfko.celldl.core.model.ParseError;

import java.util.List;

/**
 * Exception thrown by the strict entry points when CellDL source does not parse cleanly.
 * <p>
 * The message lists every error, one per line, and the structured errors stay available
 * through {@link #getErrors()} for callers that want to point at source positions.
 * </p>
 *
 * <p><strong>Message format:</strong></p>
 * <pre>{@code
 * Parse errors:
 *   Line 1:6: Expected a name (identifier or string) in cell definition, but found '{'
 *   Line 4:1: Missing closing '}' for block started at line 2
 * }</pre>
 *
 * <p><strong>Typical handling:</strong></p>
 * <pre>{@code
 * try {
 *     Program program = parser.parseOrThrow(source);
 * } catch (CellDlSyntaxException e) {
 *     e.getErrors().forEach(err -> highlight(err.line(), err.column(), err.length()));
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see CellDlParser#parseOrThrow(String)
 */
public class CellDlSyntaxException extends RuntimeException {

    private final List<ParseError> errors;

    /**
     * Constructor with an explanatory message and no structured errors, for failures that
     * have no source position.
     *
     * @param message the message describing the failure
     */
    public CellDlSyntaxException(String message) {
        super(message);
        this.errors = List.of();
    }

    /**
     * Constructor building the aggregated message from the errors.
     *
     * @param errors the parse errors, at least one
     */
    public CellDlSyntaxException(List<ParseError> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the failure
     * @param cause   the original cause
     */
    public CellDlSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    private static String format(List<ParseError> errors) {
        StringBuilder sb = new StringBuilder("Parse errors:");
        for (ParseError error : errors) {
            sb.append("\n  Line ").append(error.line()).append(':').append(error.column())
                    .append(": ").append(error.message());
        }
        return sb.toString();
    }
}
