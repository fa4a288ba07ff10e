package io.github.cyfko.celldl.core.lexer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Keyword table used by the {@link Lexer}.
 * <p>
 * Keywords are tried longest-first so that {@code cells} is never read as {@code cell}
 * followed by {@code s}, {@code userstore} never as {@code user}, {@code database} never as
 * {@code data}. A candidate is accepted only when the following character cannot extend
 * an identifier; otherwise the whole word falls back to {@link TokenKind#IDENTIFIER}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Keywords {

    private static final List<TokenKind> LONGEST_FIRST;

    static {
        List<TokenKind> keywords = new ArrayList<>();
        for (TokenKind kind : TokenKind.values()) {
            if (kind.isKeyword()) {
                keywords.add(kind);
            }
        }
        keywords.sort(Comparator.comparingInt((TokenKind k) -> k.literal().length()).reversed());
        LONGEST_FIRST = List.copyOf(keywords);
    }

    private Keywords() {}

    /**
     * Returns the keyword starting at {@code pos}, or {@code null} when the word there is not a keyword.
     *
     * @param text   text being scanned
     * @param pos    index of the first character of the word
     * @return the matching keyword kind, or {@code null}
     */
    public static TokenKind match(String text, int pos) {
        for (TokenKind keyword : LONGEST_FIRST) {
            String literal = keyword.literal();
            int end = pos + literal.length();
            if (end > text.length()) {
                continue;
            }
            if (!text.regionMatches(!keyword.caseSensitive(), pos, literal, 0, literal.length())) {
                continue;
            }
            if (end < text.length() && extendsWord(text, end)) {
                continue;
            }
            return keyword;
        }
        return null;
    }

    /**
     * Tells whether {@code word} would be lexed as a keyword rather than an identifier.
     */
    public static boolean isReserved(String word) {
        if (word == null || word.isEmpty()) {
            return false;
        }
        TokenKind kind = match(word, 0);
        return kind != null && kind.literal().length() == word.length();
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '-';
    }

    /**
     * A character at {@code index} extends the current word, except a hyphen that opens an arrow.
     */
    static boolean extendsWord(String text, int index) {
        char c = text.charAt(index);
        if (c == '-') {
            return index + 1 >= text.length() || text.charAt(index + 1) != '>';
        }
        return isIdentifierPart(c);
    }
}
