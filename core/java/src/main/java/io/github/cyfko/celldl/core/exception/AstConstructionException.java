package io.github.cyfko.celldl.core.exception;

import io.github.cyfko.celldl.core.diagnostics.ErrorCode;
import io.github.cyfko.celldl.core.lexer.Token;

import java.util.Objects;

/**
 * Exception thrown when a concrete syntax tree cannot be turned into an AST node,
 * typically because a required part such as a name is missing.
 * <p>
 * The strict builder lets it escape; the tolerant builder catches it at statement and
 * component boundaries and turns it into an error placeholder.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class AstConstructionException extends RuntimeException {

    private final ErrorCode code;
    private final transient Token token;

    /**
     * @param code    diagnostic code
     * @param message the message describing the failure
     * @param token   token the failure is located at, {@code null} when unknown
     */
    public AstConstructionException(ErrorCode code, String message, Token token) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
        this.token = token;
    }

    /**
     * @param code    diagnostic code
     * @param message the message describing the failure
     * @param token   token the failure is located at, {@code null} when unknown
     * @param cause   the original cause
     */
    public AstConstructionException(ErrorCode code, String message, Token token, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.token = token;
    }

    public ErrorCode getCode() {
        return code;
    }

    /** Token the failure is located at, may be {@code null}. */
    public Token getToken() {
        return token;
    }
}
