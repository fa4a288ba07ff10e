package io.github.cyfko.celldl.core.diagnostics;

import java.util.List;
import java.util.Objects;

/**
 * Fully described diagnostic: code, wording, source span and optional repair help.
 * <p>
 * Category and severity are not stored; they are read from the {@link ErrorCode} table so a
 * diagnostic can never disagree with its code. Columns are 1-based and the end column is
 * exclusive ({@code endColumn = column + length}).
 * </p>
 *
 * <h2>Usage example</h2>
 * <pre>{@code
 * EnhancedParseError error = EnhancedParseError.builder(ErrorCode.MISSING_COLON, "Expected ':'")
 *         .location(3, 9, 42, 4)
 *         .recoveryHint("Add ':' between the property name and value")
 *         .build();
 * }</pre>
 *
 * @param code           diagnostic code
 * @param message        human message
 * @param line           1-based start line
 * @param column         1-based start column
 * @param endLine        1-based end line
 * @param endColumn      1-based exclusive end column
 * @param offset         0-based start offset
 * @param length         span length, at least 1
 * @param recoveryHint   advice for the author, may be {@code null}
 * @param suggestedFix   machine-applicable edit, may be {@code null}
 * @param ruleName       grammar rule the error was met in, may be {@code null}
 * @param expectedTokens display names of acceptable tokens
 * @param actualToken    image of the offending token, may be {@code null}
 * @param previousTokens images of up to three tokens preceding the error
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EnhancedParseError(
        ErrorCode code,
        String message,
        int line,
        int column,
        int endLine,
        int endColumn,
        int offset,
        int length,
        String recoveryHint,
        SuggestedFix suggestedFix,
        String ruleName,
        List<String> expectedTokens,
        String actualToken,
        List<String> previousTokens
) {

    public EnhancedParseError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException(String.format("Invalid position %d:%d", line, column));
        }
        expectedTokens = expectedTokens == null ? List.of() : List.copyOf(expectedTokens);
        previousTokens = previousTokens == null ? List.of() : List.copyOf(previousTokens);
    }

    public ErrorCategory category() {
        return code.category();
    }

    public ErrorSeverity severity() {
        return code.severity();
    }

    public boolean isError() {
        return code.severity() == ErrorSeverity.ERROR;
    }

    /** Copy carrying another recovery hint. */
    public EnhancedParseError withRecoveryHint(String hint) {
        return new EnhancedParseError(code, message, line, column, endLine, endColumn, offset, length,
                hint, suggestedFix, ruleName, expectedTokens, actualToken, previousTokens);
    }

    /** Copy carrying another suggested fix. */
    public EnhancedParseError withSuggestedFix(SuggestedFix fix) {
        return new EnhancedParseError(code, message, line, column, endLine, endColumn, offset, length,
                recoveryHint, fix, ruleName, expectedTokens, actualToken, previousTokens);
    }

    /** Copy attributed to another grammar rule. */
    public EnhancedParseError withRuleName(String rule) {
        return new EnhancedParseError(code, message, line, column, endLine, endColumn, offset, length,
                recoveryHint, suggestedFix, rule, expectedTokens, actualToken, previousTokens);
    }

    public static Builder builder(ErrorCode code, String message) {
        return new Builder(code, message);
    }

    public static class Builder {
        private final ErrorCode _code;
        private final String _message;
        private int _line = 1;
        private int _column = 1;
        private int _offset;
        private int _length = 1;
        private String _recoveryHint;
        private SuggestedFix _suggestedFix;
        private String _ruleName;
        private List<String> _expectedTokens = List.of();
        private String _actualToken;
        private List<String> _previousTokens = List.of();

        private Builder(ErrorCode code, String message) {
            this._code = code;
            this._message = message;
        }

        /**
         * Sets a single-line span. A length below 1 is widened to 1 so the span stays visible.
         */
        public Builder location(int line, int column, int offset, int length) {
            this._line = line;
            this._column = column;
            this._offset = offset;
            this._length = Math.max(length, 1);
            return this;
        }

        public Builder recoveryHint(String recoveryHint) {
            this._recoveryHint = recoveryHint;
            return this;
        }

        public Builder suggestedFix(SuggestedFix suggestedFix) {
            this._suggestedFix = suggestedFix;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this._ruleName = ruleName;
            return this;
        }

        public Builder expectedTokens(List<String> expectedTokens) {
            this._expectedTokens = expectedTokens;
            return this;
        }

        public Builder actualToken(String actualToken) {
            this._actualToken = actualToken;
            return this;
        }

        public Builder previousTokens(List<String> previousTokens) {
            this._previousTokens = previousTokens;
            return this;
        }

        public EnhancedParseError build() {
            return new EnhancedParseError(_code, _message, _line, _column, _line, _column + _length,
                    _offset, _length, _recoveryHint, _suggestedFix, _ruleName, _expectedTokens,
                    _actualToken, _previousTokens);
        }
    }
}
