package io.github.cyfko.celldl.core.utils;

/**
 * Conversion between CellDL string literals and their values.
 * Supported escapes are {@code \n \r \t \" \\}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StringEscapes {

    private StringEscapes() {}

    /**
     * Value of a string literal image, quotes removed and escapes resolved.
     * An unknown escape keeps the escaped character.
     */
    public static String unquote(String image) {
        String body = image;
        if (body.length() >= 2 && body.charAt(0) == '"' && body.charAt(body.length() - 1) == '"') {
            body = body.substring(1, body.length() - 1);
        } else if (!body.isEmpty() && body.charAt(0) == '"') {
            body = body.substring(1);
        }
        return unescape(body);
    }

    public static String unescape(String text) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= text.length()) {
                sb.append(c);
                continue;
            }
            char next = text.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }

    public static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Quoted literal for {@code value}. */
    public static String quote(String value) {
        return '"' + escape(value) + '"';
    }
}
