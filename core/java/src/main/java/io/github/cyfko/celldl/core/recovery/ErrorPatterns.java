package io.github.cyfko.celldl.core.recovery;

import io.github.cyfko.celldl.core.diagnostics.DiagnosticMessages;
import io.github.cyfko.celldl.core.diagnostics.SuggestedFix;
import io.github.cyfko.celldl.core.lexer.Token;
import io.github.cyfko.celldl.core.lexer.TokenKind;
import io.github.cyfko.celldl.core.parsing.GrammarRule;
import io.github.cyfko.celldl.core.utils.EditDistance;
import io.github.cyfko.celldl.core.utils.StringEscapes;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Built-in detectors, in the order the {@link RecoveryEngine} tries them.
 *
 * <ol>
 *   <li>{@link #UNCLOSED_SCOPE_AT_EOF}: blocks left open when the input ends</li>
 *   <li>{@link #MISSING_ARROW}: two endpoint names side by side in a connection</li>
 *   <li>{@link #MISSING_COLON_AFTER_TYPE}: {@code [type database]} where the colon is required</li>
 *   <li>{@link #CELL_TYPE_TYPO} and {@link #COMPONENT_TYPE_TYPO}: misspelled vocabulary words</li>
 *   <li>{@link #MISSING_PORT_NUMBER}: {@code port} without a number</li>
 *   <li>{@link #MISSING_QUOTES}: entity names that need quoting</li>
 * </ol>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ErrorPatterns {

    private static final Set<TokenKind> NAMES = EnumSet.of(TokenKind.IDENTIFIER, TokenKind.STRING);
    private static final Set<TokenKind> ENTITY_KEYWORDS =
            EnumSet.of(TokenKind.CELL, TokenKind.EXTERNAL, TokenKind.USER, TokenKind.APPLICATION);

    public static final ErrorPattern UNCLOSED_SCOPE_AT_EOF = new UnclosedScopeAtEof();
    public static final ErrorPattern MISSING_ARROW = new MissingArrow();
    public static final ErrorPattern MISSING_COLON_AFTER_TYPE = new MissingColonAfterType();
    public static final ErrorPattern CELL_TYPE_TYPO = new VocabularyTypo("cellTypeTypo", "cell type",
            DiagnosticMessages.VALID_CELL_TYPES, true);
    public static final ErrorPattern COMPONENT_TYPE_TYPO = new VocabularyTypo("componentTypeTypo", "component type",
            DiagnosticMessages.VALID_COMPONENT_TYPES, false);
    public static final ErrorPattern MISSING_PORT_NUMBER = new MissingPortNumber();
    public static final ErrorPattern MISSING_QUOTES = new MissingQuotes();

    private static final List<ErrorPattern> DEFAULTS = List.of(
            UNCLOSED_SCOPE_AT_EOF,
            MISSING_ARROW,
            MISSING_COLON_AFTER_TYPE,
            CELL_TYPE_TYPO,
            COMPONENT_TYPE_TYPO,
            MISSING_PORT_NUMBER,
            MISSING_QUOTES);

    private ErrorPatterns() {}

    public static List<ErrorPattern> defaults() {
        return DEFAULTS;
    }

    private static final class UnclosedScopeAtEof implements ErrorPattern {

        @Override
        public String name() {
            return "unclosedScopeAtEof";
        }

        @Override
        public boolean matches(PatternContext context) {
            if (!context.atEnd() || context.lastToken() == null || context.unclosedBraces().isEmpty()) {
                return false;
            }
            // a value missing at the very end is left to the more specific detectors
            return context.openingToken() != null
                    || context.expected().isEmpty()
                    || context.expected().contains(TokenKind.RBRACE);
        }

        @Override
        public RecoverySuggestion suggest(PatternContext context) {
            int insertAt = context.lastToken().endOffset();
            Token opening = context.openingToken();
            if (opening != null) {
                // one error per unclosed block; the innermost one also closes stray braces inside it
                int count = 1 + context.strayBraces();
                String description = count == 1
                        ? "Insert closing brace"
                        : String.format("Insert %d closing braces", count);
                return new RecoverySuggestion(name(),
                        String.format("Missing closing '}' for block opened at line %d", opening.line()),
                        SuggestedFix.insert(description, "}".repeat(count), insertAt));
            }
            List<Token> braces = context.unclosedBraces();
            int depth = braces.size();
            String hint = depth == 1
                    ? String.format("Missing closing '}' for block opened at line %d", braces.get(0).line())
                    : String.format("Missing %d closing '}' braces", depth);
            String description = depth == 1 ? "Insert closing brace" : String.format("Insert %d closing braces", depth);
            return new RecoverySuggestion(name(), hint, SuggestedFix.insert(description, "}".repeat(depth), insertAt));
        }
    }

    private static final class MissingArrow implements ErrorPattern {

        @Override
        public String name() {
            return "missingArrow";
        }

        @Override
        public boolean matches(PatternContext context) {
            if (!context.inRule(GrammarRule.CONNECTION, GrammarRule.FLOW_STATEMENT,
                    GrammarRule.CONNECTIONS_BLOCK, GrammarRule.FLOW_BLOCK)) {
                return false;
            }
            Token previous = context.token(-1);
            Token current = context.current();
            return previous != null && current != null
                    && NAMES.contains(previous.kind()) && NAMES.contains(current.kind());
        }

        @Override
        public RecoverySuggestion suggest(PatternContext context) {
            return new RecoverySuggestion(name(),
                    "Use '->' to connect flow endpoints. Example: source -> destination",
                    SuggestedFix.insert("Insert '->' between source and target", " -> ", context.token(-1).endOffset()));
        }
    }

    private static final class MissingColonAfterType implements ErrorPattern {

        @Override
        public String name() {
            return "missingColonAfterType";
        }

        @Override
        public boolean matches(PatternContext context) {
            Token previous = context.token(-1);
            Token current = context.current();
            if (previous == null || current == null || !previous.is(TokenKind.TYPE)) {
                return false;
            }
            return context.expected().contains(TokenKind.COLON)
                    && (current.is(TokenKind.IDENTIFIER) || TokenKind.valueWords().contains(current.kind()));
        }

        @Override
        public RecoverySuggestion suggest(PatternContext context) {
            return new RecoverySuggestion(name(),
                    "Expected ':' after 'type' keyword. Example: type: database",
                    SuggestedFix.insert("Insert ':' after 'type'", ":", context.token(-1).endOffset()));
        }
    }

    private static final class VocabularyTypo implements ErrorPattern {

        private final String name;
        private final String what;
        private final List<String> vocabulary;
        private final boolean cellTypes;

        private VocabularyTypo(String name, String what, List<String> vocabulary, boolean cellTypes) {
            this.name = name;
            this.what = what;
            this.vocabulary = vocabulary;
            this.cellTypes = cellTypes;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean matches(PatternContext context) {
            Token current = context.current();
            if (current == null || !current.is(TokenKind.IDENTIFIER)) {
                return false;
            }
            if (cellTypes) {
                return context.inRule(GrammarRule.CELL_TYPE);
            }
            if (context.inRule(GrammarRule.COMPONENT_TYPE, GrammarRule.COMPONENTS_BLOCK, GrammarRule.CLUSTER_DEFINITION)) {
                return true;
            }
            // "databse Orders" inside a cell: an unknown word followed by a name
            Token next = context.token(1);
            return context.inRule(GrammarRule.CELL_BODY) && next != null && NAMES.contains(next.kind());
        }

        @Override
        public RecoverySuggestion suggest(PatternContext context) {
            Token current = context.current();
            String closest = EditDistance.findClosestMatch(current.image(), vocabulary);
            if (closest == null) {
                return new RecoverySuggestion(name,
                        String.format("'%s' is not a valid %s. Valid types are: %s",
                                current.image(), what, String.join(", ", vocabulary)),
                        null);
            }
            String hint = cellTypes
                    ? String.format("Did you mean '%s'? Valid cell types are: %s", closest, String.join(", ", vocabulary))
                    : String.format("Did you mean '%s'?", closest);
            return new RecoverySuggestion(name, hint, new SuggestedFix(
                    String.format("Replace '%s' with '%s'", current.image(), closest),
                    closest, current.offset(), current.endOffset()));
        }
    }

    private static final class MissingPortNumber implements ErrorPattern {

        @Override
        public String name() {
            return "missingPortNumber";
        }

        @Override
        public boolean matches(PatternContext context) {
            Token current = context.current();
            if (current != null && current.is(TokenKind.NUMBER)) {
                return false;
            }
            Token previous = context.token(-1);
            if (previous != null && previous.is(TokenKind.COLON)) {
                previous = context.token(-2);
            }
            return previous != null && previous.is(TokenKind.PORT);
        }

        @Override
        public RecoverySuggestion suggest(PatternContext context) {
            return new RecoverySuggestion(name(), "Port requires a number. Example: port 8080",
                    SuggestedFix.insert("Insert port number", " 8080", context.token(-1).endOffset()));
        }
    }

    private static final class MissingQuotes implements ErrorPattern {

        @Override
        public String name() {
            return "missingQuotes";
        }

        @Override
        public boolean matches(PatternContext context) {
            return keywordAsName(context) || multiWordName(context);
        }

        /** {@code cell data {}}: a reserved word used as a name. */
        private static boolean keywordAsName(PatternContext context) {
            Token previous = context.token(-1);
            Token current = context.current();
            return previous != null && current != null
                    && ENTITY_KEYWORDS.contains(previous.kind()) && current.kind().isKeyword();
        }

        /** {@code cell Order Service {}}: a name with a space in it. */
        private static boolean multiWordName(PatternContext context) {
            Token keyword = context.token(-2);
            Token first = context.token(-1);
            Token current = context.current();
            return keyword != null && first != null && current != null
                    && ENTITY_KEYWORDS.contains(keyword.kind())
                    && first.is(TokenKind.IDENTIFIER) && current.is(TokenKind.IDENTIFIER);
        }

        @Override
        public RecoverySuggestion suggest(PatternContext context) {
            Token current = context.current();
            Token start = keywordAsName(context) ? current : context.token(-1);
            Token keyword = keywordAsName(context) ? context.token(-1) : context.token(-2);
            String text = start == current ? current.image() : start.image() + " " + current.image();
            String entity = keyword.kind().literal();
            return new RecoverySuggestion(name(),
                    String.format("%s names that are keywords or contain spaces must be quoted. Example: %s \"My Name\" { }",
                            entity, entity),
                    new SuggestedFix(String.format("Wrap '%s' in quotes", text),
                            StringEscapes.quote(text), start.offset(), current.endOffset()));
        }
    }
}
