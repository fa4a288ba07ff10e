package io.github.cyfko.celldl.core.recovery;

import io.github.cyfko.celldl.core.lexer.Token;
import io.github.cyfko.celldl.core.lexer.TokenKind;
import io.github.cyfko.celldl.core.parsing.GrammarRule;
import io.github.cyfko.celldl.core.parsing.SyntaxError;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * What a detector sees of an error: the token stream, the error position, the rule being
 * parsed, the expected token kinds and the delimiters still open at that position.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PatternContext {

    private final List<Token> tokens;
    private final int position;
    private final GrammarRule rule;
    private final List<TokenKind> expected;
    private final List<Token> openDelimiters;
    private final Token openingToken;
    private final int strayBraces;

    private PatternContext(List<Token> tokens, int position, GrammarRule rule,
                           List<TokenKind> expected, Token openingToken, int strayBraces) {
        this.tokens = List.copyOf(tokens);
        this.strayBraces = strayBraces;
        this.position = position;
        this.rule = rule;
        this.expected = List.copyOf(expected);
        this.openingToken = openingToken;
        this.openDelimiters = replayDelimiters(this.tokens, position);
    }

    /**
     * Context for a parser error.
     */
    public static PatternContext of(List<Token> tokens, SyntaxError error) {
        Objects.requireNonNull(error, "error");
        return new PatternContext(tokens, error.tokenIndex(), error.rule(), error.expected(), error.openingToken(),
                error.strayBraces());
    }

    /**
     * Context for an arbitrary position, e.g. to ask for help at a cursor.
     *
     * @param tokens   token stream
     * @param position index of the offending token, {@code tokens.size()} for end of input
     * @param rule     rule being parsed, may be {@code null}
     */
    public static PatternContext at(List<Token> tokens, int position, GrammarRule rule) {
        return new PatternContext(tokens, position, rule, List.of(), null, 0);
    }

    /**
     * Replays brackets, braces and parentheses up to {@code position}; a closer only pops a
     * matching opener.
     */
    private static List<Token> replayDelimiters(List<Token> tokens, int position) {
        List<Token> stack = new ArrayList<>();
        int last = Math.min(position, tokens.size() - 1);
        for (int i = 0; i <= last; i++) {
            Token token = tokens.get(i);
            switch (token.kind()) {
                case LBRACE, LBRACKET, LPAREN -> stack.add(token);
                case RBRACE -> popIf(stack, TokenKind.LBRACE);
                case RBRACKET -> popIf(stack, TokenKind.LBRACKET);
                case RPAREN -> popIf(stack, TokenKind.LPAREN);
                default -> {
                }
            }
        }
        return stack;
    }

    private static void popIf(List<Token> stack, TokenKind opener) {
        if (!stack.isEmpty() && stack.get(stack.size() - 1).is(opener)) {
            stack.remove(stack.size() - 1);
        }
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int position() {
        return position;
    }

    /** Rule being parsed, may be {@code null}. */
    public GrammarRule rule() {
        return rule;
    }

    public boolean inRule(GrammarRule... candidates) {
        for (GrammarRule candidate : candidates) {
            if (candidate == rule) {
                return true;
            }
        }
        return false;
    }

    public List<TokenKind> expected() {
        return expected;
    }

    /** Opening brace of the block an unclosed-block error is about, otherwise {@code null}. */
    public Token openingToken() {
        return openingToken;
    }

    /** Braces left open inside the unclosed block by skipped input. */
    public int strayBraces() {
        return strayBraces;
    }

    /** Delimiters still open at the error position, innermost last. */
    public List<Token> openDelimiters() {
        return openDelimiters;
    }

    public List<Token> unclosedBraces() {
        List<Token> braces = new ArrayList<>();
        for (Token token : openDelimiters) {
            if (token.is(TokenKind.LBRACE)) {
                braces.add(token);
            }
        }
        return braces;
    }

    /**
     * Token at {@code position + delta}.
     *
     * @return the token, or {@code null} outside the stream
     */
    public Token token(int delta) {
        int index = position + delta;
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    /** Offending token, {@code null} at end of input. */
    public Token current() {
        return token(0);
    }

    public Token lastToken() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    /** Whether the error sits on the last token or at the end of input. */
    public boolean atEnd() {
        return position >= tokens.size() - 1;
    }
}
