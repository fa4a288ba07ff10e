package io.github.cyfko.celldl.core.diagnostics;

import io.github.cyfko.celldl.core.lexer.LexError;
import io.github.cyfko.celldl.core.lexer.Token;
import io.github.cyfko.celldl.core.lexer.TokenKind;
import io.github.cyfko.celldl.core.parsing.GrammarRule;
import io.github.cyfko.celldl.core.parsing.SyntaxError;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw lexer and parser errors into {@link EnhancedParseError}s with human wording,
 * a code from the catalogue and a default recovery hint.
 * <p>
 * Wording depends on what was expected and on the rule being parsed. A missing closing brace,
 * for instance, is reported on the opening brace of the block it fails to close, with the line
 * that block started on.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DiagnosticMessages {

    public static final List<String> VALID_CELL_TYPES =
            List.of("logic", "integration", "data", "security", "channel", "legacy");
    public static final List<String> VALID_COMPONENT_TYPES = List.of(
            "microservice", "ms", "function", "fn", "database", "db",
            "broker", "cache", "gateway", "idp", "sts", "userstore",
            "esb", "adapter", "transformer", "webapp", "mobile", "iot", "legacy");
    public static final List<String> VALID_EXTERNAL_TYPES = List.of("saas", "partner", "enterprise");
    public static final List<String> VALID_USER_TYPES = List.of("external", "internal", "system");
    public static final List<String> VALID_PROTOCOLS = List.of("https", "http", "grpc", "tcp", "mtls", "kafka");
    public static final List<String> VALID_POSITIONS = List.of("north", "south", "east", "west");

    private static final int PREVIOUS_TOKENS = 3;

    private DiagnosticMessages() {}

    /**
     * Display name of a token kind, e.g. {@code "'{'"}, {@code "an identifier"}.
     */
    public static String displayName(TokenKind kind) {
        switch (kind) {
            case STRING:
                return "a string (e.g., \"example\")";
            case NUMBER:
                return "a number (e.g., 8080)";
            case IDENTIFIER:
                return "an identifier";
            case EOF:
                return "end of input";
            default:
                return kind.displayName();
        }
    }

    /**
     * Joins display names: {@code "a"}, {@code "a or b"}, {@code "a, b, or c"}.
     */
    public static String formatExpectedTokens(List<TokenKind> kinds) {
        List<String> names = new ArrayList<>();
        for (TokenKind kind : kinds) {
            names.add(displayName(kind));
        }
        return joinAlternatives(names);
    }

    static String joinAlternatives(List<String> names) {
        if (names.isEmpty()) {
            return "";
        }
        if (names.size() == 1) {
            return names.get(0);
        }
        if (names.size() == 2) {
            return names.get(0) + " or " + names.get(1);
        }
        return String.join(", ", names.subList(0, names.size() - 1)) + ", or " + names.get(names.size() - 1);
    }

    /**
     * Converts a lexical error. Lexical errors carry no hint except for unterminated strings.
     */
    public static EnhancedParseError fromLexError(LexError error) {
        String hint = error.code() == ErrorCode.UNTERMINATED_STRING
                ? "Close the string with '\"' before the end of the line"
                : null;
        return EnhancedParseError.builder(error.code(), error.message())
                .location(error.line(), error.column(), error.offset(), error.length())
                .recoveryHint(hint)
                .build();
    }

    /**
     * Converts a syntax error using the token stream for context.
     *
     * @param error  raw parser error
     * @param tokens token stream the error indexes into
     */
    public static EnhancedParseError fromSyntaxError(SyntaxError error, List<Token> tokens) {
        Token actual = error.token();
        Token anchor = error.isUnclosedBlock() ? error.openingToken() : actual;
        Wording wording = wording(error);

        List<String> expected = new ArrayList<>();
        for (TokenKind kind : error.expected()) {
            expected.add(displayName(kind));
        }
        List<String> previous = new ArrayList<>();
        for (int i = Math.max(0, error.tokenIndex() - PREVIOUS_TOKENS); i < Math.min(error.tokenIndex(), tokens.size()); i++) {
            previous.add(tokens.get(i).image());
        }

        return EnhancedParseError.builder(wording.code, wording.message)
                .location(anchor.line(), anchor.column(), anchor.offset(), anchor.length())
                .recoveryHint(wording.hint)
                .ruleName(error.rule().ruleName())
                .expectedTokens(expected)
                .actualToken(actual.is(TokenKind.EOF) ? null : actual.image())
                .previousTokens(previous)
                .build();
    }

    /**
     * Code a syntax error maps to.
     */
    public static ErrorCode codeFor(SyntaxError error) {
        return wording(error).code;
    }

    private static Wording wording(SyntaxError error) {
        switch (error.kind()) {
            case MISMATCHED_TOKEN:
                return missingToken(error);
            case NO_VIABLE_ALTERNATIVE:
                return noViableAlternative(error);
            case EARLY_EXIT:
                return earlyExit(error);
            default:
                return new Wording(ErrorCode.REDUNDANT_INPUT,
                        String.format("Unexpected %s after end of valid input", found(error.token())),
                        "Remove the extra content or check for missing block delimiters");
        }
    }

    private static Wording missingToken(SyntaxError error) {
        String found = found(error.token());
        String where = error.rule().description();
        if (error.isUnclosedBlock()) {
            return new Wording(ErrorCode.MISSING_CLOSING_BRACE,
                    String.format("Missing closing '}' for block started at line %d", error.openingToken().line()),
                    "Add '}' to close the block");
        }
        List<TokenKind> expected = error.expected();
        if (expected.contains(TokenKind.IDENTIFIER) && expected.contains(TokenKind.STRING)) {
            return new Wording(ErrorCode.MISSING_IDENTIFIER,
                    String.format("Expected a name (identifier or string) in %s, but found %s", where, found),
                    "Provide a name starting with a letter or underscore, or quote it");
        }
        TokenKind kind = expected.isEmpty() ? TokenKind.EOF : expected.get(0);
        switch (kind) {
            case LBRACE:
                return new Wording(ErrorCode.MISSING_OPENING_BRACE,
                        String.format("Expected '{' to start the %s, but found %s", where, found),
                        String.format("Add '{' to begin the %s", where));
            case RBRACE:
                return new Wording(ErrorCode.MISSING_CLOSING_BRACE,
                        String.format("Expected '}' to close the %s, but found %s", where, found),
                        "Check for missing '}' or extra content in the block");
            case LBRACKET:
                return new Wording(ErrorCode.MISSING_OPENING_BRACKET,
                        String.format("Expected '[' to start a list, but found %s", found),
                        "Write lists as [item1, item2]");
            case RBRACKET:
                return new Wording(ErrorCode.MISSING_CLOSING_BRACKET,
                        String.format("Expected ']' to close the list, but found %s", found),
                        "Add ']' to close the list");
            case LPAREN:
                return new Wording(ErrorCode.MISSING_OPENING_PAREN,
                        String.format("Expected '(', but found %s", found), null);
            case RPAREN:
                return new Wording(ErrorCode.MISSING_CLOSING_PAREN,
                        String.format("Expected ')', but found %s", found),
                        "Add ')' to close the parenthesis");
            case COLON:
                return new Wording(ErrorCode.MISSING_COLON,
                        String.format("Expected ':' after property name, but found %s", found),
                        "Add ':' between the property name and value");
            case ARROW:
                return new Wording(ErrorCode.MISSING_ARROW,
                        String.format("Expected '->' between connection endpoints, but found %s", found),
                        "Use '->' to connect endpoints. Example: source -> destination");
            case EQUALS:
                return new Wording(ErrorCode.MISSING_EQUALS,
                        String.format("Expected '=' after environment variable name, but found %s", found),
                        "Write environment variables as KEY = \"value\"");
            case COMMA:
                return new Wording(ErrorCode.MISSING_COMMA,
                        String.format("Missing ',' before %s", found),
                        "Separate list items with ','");
            case IDENTIFIER:
                return new Wording(ErrorCode.MISSING_IDENTIFIER,
                        String.format("Expected an identifier (name), but found %s", found),
                        "Provide a valid name starting with a letter or underscore");
            case STRING:
                return new Wording(ErrorCode.MISSING_STRING_LITERAL,
                        String.format("Expected a quoted string, but found %s", found),
                        "Wrap the value in double quotes. Example: \"MyValue\"");
            case NUMBER:
                return new Wording(ErrorCode.MISSING_NUMBER_LITERAL,
                        String.format("Expected a number, but found %s", found),
                        "Provide a numeric value. Example: 8080");
            default:
                ErrorCode code = kind.isKeyword() ? ErrorCode.MISSING_KEYWORD : ErrorCode.UNEXPECTED_TOKEN;
                return new Wording(code,
                        String.format("Expected %s, but found %s", formatExpectedTokens(expected), found), null);
        }
    }

    private static Wording noViableAlternative(SyntaxError error) {
        Token token = error.token();
        String found = found(token);
        GrammarRule rule = error.rule();
        switch (rule) {
            case CELL_TYPE:
                return invalidValue(ErrorCode.INVALID_CELL_TYPE, token, "cell type", VALID_CELL_TYPES);
            case COMPONENT_TYPE:
                return invalidValue(ErrorCode.INVALID_COMPONENT_TYPE, token, "component type", VALID_COMPONENT_TYPES);
            case EXTERNAL_TYPE:
                return invalidValue(ErrorCode.INVALID_EXTERNAL_TYPE, token, "external system type", VALID_EXTERNAL_TYPES);
            case USER_TYPE:
                return invalidValue(ErrorCode.INVALID_USER_TYPE, token, "user type", VALID_USER_TYPES);
            case PROTOCOL_VALUE:
                return invalidValue(ErrorCode.INVALID_PROTOCOL, token, "protocol", VALID_PROTOCOLS);
            case GATEWAY_POSITION:
                return invalidValue(ErrorCode.INVALID_GATEWAY_DIRECTION, token, "gateway position", VALID_POSITIONS);
            case COMPONENTS_BLOCK:
                if (token.is(TokenKind.IDENTIFIER)) {
                    return invalidValue(ErrorCode.INVALID_COMPONENT_TYPE, token, "component type", VALID_COMPONENT_TYPES);
                }
                break;
            case CELL_BODY:
            case CELL_DEFINITION:
                return new Wording(ErrorCode.INCOMPLETE_CELL_DEFINITION,
                        String.format("Unexpected %s in cell definition", found),
                        "A cell definition needs: cell \"Name\" type:cellType { ... }");
            case GATEWAY_BLOCK:
                return new Wording(ErrorCode.INCOMPLETE_GATEWAY_DEFINITION,
                        String.format("Unexpected %s in gateway definition", found),
                        "A gateway definition needs: gateway { exposes: [api] }");
            case COMPONENT_BODY:
            case COMPONENT_DEFINITION:
            case ATTRIBUTE_LIST:
            case ATTRIBUTE:
                return new Wording(ErrorCode.INCOMPLETE_COMPONENT_DEFINITION,
                        String.format("Unexpected %s in component definition", found),
                        "Component format: componentType ComponentName [key: value] or { properties }");
            case CONNECTION:
            case FLOW_STATEMENT:
            case CONNECTIONS_BLOCK:
            case FLOW_BLOCK:
            case CONNECTION_ATTRIBUTES:
                return new Wording(ErrorCode.INCOMPLETE_FLOW_STATEMENT,
                        String.format("Unexpected %s in %s", found, rule.description()),
                        "Flow format: source -> destination");
            case PROPERTY_VALUE:
                return new Wording(ErrorCode.INVALID_ATTRIBUTE_VALUE,
                        String.format("Expected a value, but found %s", found),
                        "Values are strings, numbers, booleans, identifiers or [lists]");
            default:
                break;
        }
        String expected = error.expected().isEmpty() ? "valid syntax" : formatExpectedTokens(error.expected());
        return new Wording(ErrorCode.NO_VIABLE_ALTERNATIVE,
                String.format("Unexpected %s in %s. Expected %s", found, rule.description(), expected), null);
    }

    private static Wording earlyExit(SyntaxError error) {
        String found = found(error.token());
        switch (error.rule()) {
            case FLOW_BLOCK:
                return new Wording(ErrorCode.EARLY_EXIT,
                        String.format("Expected at least one flow statement, but found %s", found),
                        "Add at least one flow: source -> destination");
            case COMPONENTS_BLOCK:
                return new Wording(ErrorCode.EARLY_EXIT,
                        String.format("Expected at least one component, but found %s", found),
                        "Add at least one component inside the components block");
            default:
                return new Wording(ErrorCode.EARLY_EXIT,
                        String.format("The %s needs at least one element, but found %s", error.rule().description(), found),
                        String.format("Add at least one of: %s", formatExpectedTokens(error.expected())));
        }
    }

    private static Wording invalidValue(ErrorCode code, Token token, String what, List<String> valid) {
        String hint = String.format("Valid values are: %s", String.join(", ", valid));
        // no value at all: end of input or a delimiter where the word should be
        if (token.is(TokenKind.EOF) || token.kind().isPunctuation()) {
            return new Wording(code, String.format("Expected a %s, but found %s", what, found(token)), hint);
        }
        return new Wording(code, String.format("'%s' is not a valid %s", token.image(), what), hint);
    }

    private static String found(Token token) {
        return token.is(TokenKind.EOF) ? "end of input" : "'" + token.image() + "'";
    }

    private static final class Wording {
        private final ErrorCode code;
        private final String message;
        private final String hint;

        private Wording(ErrorCode code, String message, String hint) {
            this.code = code;
            this.message = message;
            this.hint = hint;
        }
    }
}
