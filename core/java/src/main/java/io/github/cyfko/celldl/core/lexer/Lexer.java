package io.github.cyfko.celldl.core.lexer;

import io.github.cyfko.celldl.core.diagnostics.ErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass tokenizer for CellDL source text.
 * <p>
 * The lexer never throws on malformed input: illegal characters, unterminated strings or
 * comments and bad escapes are recorded as {@link LexError}s and scanning resumes right after
 * the offending text. Whitespace and comments are discarded, but line/column tracking runs
 * over them so that token spans stay exact.
 * </p>
 *
 * <h2>Lexical rules</h2>
 * <pre>
 * whitespace   := [ \t\r\n\f]+                         (skipped)
 * lineComment  := '//' ~[\r\n]*                        (skipped)
 * blockComment := '/*' .*? '*&#47;'                    (skipped, does not nest)
 * string       := '"' ( ~["\\\r\n] | '\\' [nrt"\\] )* '"'
 * number       := '-'? [0-9]+ ('.' [0-9]+)?
 * identifier   := [a-zA-Z_] [a-zA-Z0-9_-]*
 * punctuation  := '-&gt;' | '=' | '.' | '{' | '}' | '[' | ']' | '(' | ')' | ':' | ','
 * </pre>
 *
 * <h2>Usage example</h2>
 * <pre>{@code
 * LexResult result = Lexer.tokenize("cell Orders { type: logic }");
 * result.tokens().forEach(System.out::println);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see Keywords
 */
public final class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<LexError> errors = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int column = 1;

    private Lexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the whole source.
     *
     * @param source DSL text, {@code null} is treated as empty
     * @return tokens and lexical errors, never {@code null}
     */
    public static LexResult tokenize(String source) {
        Lexer lexer = new Lexer(source == null ? "" : source);
        lexer.run();
        return new LexResult(lexer.tokens, lexer.errors);
    }

    private void run() {
        int n = source.length();
        while (pos < n) {
            char c = source.charAt(pos);

            if (isWhitespace(c)) {
                advance(1);
            } else if (c == '/' && peek(1) == '/') {
                skipLineComment();
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else if (c == '"') {
                scanString();
            } else if (c == '-' && peek(1) == '>') {
                emit(TokenKind.ARROW, 2);
            } else if (isDigit(c) || (c == '-' && isDigit(peek(1)))) {
                scanNumber();
            } else if (Keywords.isIdentifierStart(c)) {
                scanWord();
            } else {
                TokenKind punctuation = punctuation(c);
                if (punctuation != null) {
                    emit(punctuation, 1);
                } else {
                    scanIllegal();
                }
            }
        }
    }

    private void skipLineComment() {
        int end = pos;
        while (end < source.length() && source.charAt(end) != '\n' && source.charAt(end) != '\r') {
            end++;
        }
        advance(end - pos);
    }

    private void skipBlockComment() {
        int close = source.indexOf("*/", pos + 2);
        if (close < 0) {
            error(ErrorCode.UNEXPECTED_CHARACTER, "Unterminated block comment", line, column, pos, source.length() - pos);
            advance(source.length() - pos);
            return;
        }
        advance(close + 2 - pos);
    }

    private void scanString() {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        int i = pos + 1;
        while (true) {
            if (i >= source.length() || source.charAt(i) == '\n' || source.charAt(i) == '\r') {
                error(ErrorCode.UNTERMINATED_STRING, "Unterminated string literal", startLine, startColumn, start, i - start);
                advance(i - pos);
                return;
            }
            char c = source.charAt(i);
            if (c == '"') {
                break;
            }
            if (c == '\\') {
                char escaped = i + 1 < source.length() ? source.charAt(i + 1) : '\0';
                if (escaped == '\n' || escaped == '\r' || escaped == '\0') {
                    i++;
                    continue;
                }
                if ("nrt\"\\".indexOf(escaped) < 0) {
                    error(ErrorCode.INVALID_ESCAPE_SEQUENCE,
                            String.format("Invalid escape sequence '\\%c' in string literal", escaped),
                            startLine, startColumn + (i - start), i, 2);
                }
                i += 2;
                continue;
            }
            i++;
        }
        emit(TokenKind.STRING, i + 1 - pos);
    }

    private void scanNumber() {
        int i = pos;
        if (source.charAt(i) == '-') {
            i++;
        }
        while (i < source.length() && isDigit(source.charAt(i))) {
            i++;
        }
        if (i + 1 < source.length() && source.charAt(i) == '.' && isDigit(source.charAt(i + 1))) {
            i++;
            while (i < source.length() && isDigit(source.charAt(i))) {
                i++;
            }
        }
        if (i < source.length() && Keywords.isIdentifierStart(source.charAt(i))) {
            int end = i;
            while (end < source.length() && Keywords.isIdentifierPart(source.charAt(end))) {
                end++;
            }
            error(ErrorCode.INVALID_NUMBER,
                    String.format("Invalid number '%s'", source.substring(pos, end)),
                    line, column, pos, end - pos);
            advance(end - pos);
            return;
        }
        emit(TokenKind.NUMBER, i - pos);
    }

    private void scanWord() {
        TokenKind keyword = Keywords.match(source, pos);
        if (keyword != null) {
            emit(keyword, keyword.literal().length());
            return;
        }
        int end = pos + 1;
        while (end < source.length() && Keywords.extendsWord(source, end)) {
            end++;
        }
        emit(TokenKind.IDENTIFIER, end - pos);
    }

    private void scanIllegal() {
        int end = pos + 1;
        while (end < source.length() && !canStartToken(end)) {
            end++;
        }
        String text = source.substring(pos, end);
        error(ErrorCode.UNEXPECTED_CHARACTER,
                text.length() == 1
                        ? String.format("Unexpected character '%s'", text)
                        : String.format("Unexpected characters '%s'", text),
                line, column, pos, end - pos);
        advance(end - pos);
    }

    private boolean canStartToken(int index) {
        char c = source.charAt(index);
        if (isWhitespace(c) || c == '"' || isDigit(c) || Keywords.isIdentifierStart(c) || punctuation(c) != null) {
            return true;
        }
        char next = index + 1 < source.length() ? source.charAt(index + 1) : '\0';
        return (c == '-' && (next == '>' || isDigit(next))) || (c == '/' && (next == '/' || next == '*'));
    }

    private void emit(TokenKind kind, int length) {
        tokens.add(new Token(kind, source.substring(pos, pos + length), line, column, pos, length));
        advance(length);
    }

    private void error(ErrorCode code, String message, int errLine, int errColumn, int offset, int length) {
        errors.add(new LexError(code, message, errLine, errColumn, offset, Math.max(length, 1)));
    }

    /**
     * Moves forward {@code count} characters, keeping line and column in step.
     * A CRLF pair counts as a single line break.
     */
    private void advance(int count) {
        int end = pos + count;
        while (pos < end) {
            char c = source.charAt(pos);
            if (c == '\n' || (c == '\r' && (pos + 1 >= source.length() || source.charAt(pos + 1) != '\n'))) {
                line++;
                column = 1;
            } else if (c != '\r') {
                column++;
            }
            pos++;
        }
    }

    private char peek(int ahead) {
        int index = pos + ahead;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static TokenKind punctuation(char c) {
        return switch (c) {
            case '=' -> TokenKind.EQUALS;
            case '.' -> TokenKind.DOT;
            case '{' -> TokenKind.LBRACE;
            case '}' -> TokenKind.RBRACE;
            case '[' -> TokenKind.LBRACKET;
            case ']' -> TokenKind.RBRACKET;
            case '(' -> TokenKind.LPAREN;
            case ')' -> TokenKind.RPAREN;
            case ':' -> TokenKind.COLON;
            case ',' -> TokenKind.COMMA;
            default -> null;
        };
    }
}
