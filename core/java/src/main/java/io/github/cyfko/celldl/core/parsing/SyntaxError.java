package io.github.cyfko.celldl.core.parsing;

import io.github.cyfko.celldl.core.lexer.Token;
import io.github.cyfko.celldl.core.lexer.TokenKind;

import java.util.List;

/**
 * Raw syntax error recorded by the {@link GrammarParser}. Wording, codes and hints are added
 * later by the diagnostics layer.
 *
 * @param kind         what went wrong
 * @param token        offending token (an end-of-input token when the input ran out)
 * @param tokenIndex   index of {@code token} in the token stream, equal to the stream size for end of input
 * @param expected     token kinds that would have been accepted, possibly empty
 * @param rule         innermost rule being parsed
 * @param openingToken opening delimiter of an unclosed block, {@code null} for other errors
 * @param strayBraces  braces left open inside that block by skipped input, counted on the
 *                     innermost unclosed block only
 */
public record SyntaxError(
        Kind kind,
        Token token,
        int tokenIndex,
        List<TokenKind> expected,
        GrammarRule rule,
        Token openingToken,
        int strayBraces
) {

    public enum Kind {
        /** A specific token was required but another one was found. */
        MISMATCHED_TOKEN,
        /** No alternative of the rule accepts the current token. */
        NO_VIABLE_ALTERNATIVE,
        /** A repetition that needs at least one element got none. */
        EARLY_EXIT,
        /** Tokens remain after the root wrapper was closed. */
        NOT_ALL_INPUT_PARSED
    }

    public SyntaxError {
        expected = List.copyOf(expected);
    }

    public SyntaxError(Kind kind, Token token, int tokenIndex, List<TokenKind> expected,
                       GrammarRule rule, Token openingToken) {
        this(kind, token, tokenIndex, expected, rule, openingToken, 0);
    }

    public boolean isUnclosedBlock() {
        return openingToken != null;
    }
}
