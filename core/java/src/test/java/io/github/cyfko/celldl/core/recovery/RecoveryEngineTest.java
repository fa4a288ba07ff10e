package io.github.cyfko.celldl.core.recovery;

import io.github.cyfko.celldl.core.diagnostics.DiagnosticMessages;
import io.github.cyfko.celldl.core.diagnostics.EnhancedParseError;
import io.github.cyfko.celldl.core.diagnostics.ErrorCode;
import io.github.cyfko.celldl.core.diagnostics.SuggestedFix;
import io.github.cyfko.celldl.core.lexer.Lexer;
import io.github.cyfko.celldl.core.lexer.Token;
import io.github.cyfko.celldl.core.parsing.GrammarParser;
import io.github.cyfko.celldl.core.parsing.ParseTree;
import io.github.cyfko.celldl.core.parsing.SyntaxError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("RecoveryEngine")
class RecoveryEngineTest {

    private final RecoveryEngine engine = new RecoveryEngine();

    private static ParseTree parse(String source) {
        return GrammarParser.parse(Lexer.tokenize(source).tokens());
    }

    /** Suggestion for the first syntax error of {@code source}. */
    private RecoverySuggestion suggestFor(String source) {
        ParseTree tree = parse(source);
        assertFalse(tree.errors().isEmpty(), "Expected a syntax error");
        return engine.suggest(tree.tokens(), tree.errors().get(0))
                .orElseThrow(() -> new AssertionError("No pattern matched " + tree.errors().get(0)));
    }

    // ==================== Built-in detectors ====================

    @Nested
    @DisplayName("Built-in detectors")
    class DetectorTests {

        @Test
        @DisplayName("Unclosed block at end of input gets a closing brace")
        void unclosedBlock() {
            // When
            RecoverySuggestion suggestion = suggestFor("cell Orders {");

            // Then
            assertEquals("unclosedScopeAtEof", suggestion.patternName());
            assertEquals("Missing closing '}' for block opened at line 1", suggestion.hint());
            assertEquals("}", suggestion.fix().replacement());
            assertEquals(13, suggestion.fix().startOffset());
            assertTrue(suggestion.fix().isInsertion());
        }

        @Test
        @DisplayName("Several open braces at a cursor are closed together")
        void severalOpenBraces() {
            // Given
            List<Token> tokens = Lexer.tokenize("cell A {\n components {").tokens();

            // When
            Optional<RecoverySuggestion> suggestion = engine.suggest(PatternContext.at(tokens, tokens.size(), null));

            // Then
            assertTrue(suggestion.isPresent());
            assertEquals("Missing 2 closing '}' braces", suggestion.get().hint());
            assertEquals("}}", suggestion.get().fix().replacement());
        }

        @Test
        @DisplayName("The innermost unclosed block also closes stray braces left open inside it")
        void strayBracesClosedWithInnermostBlock() {
            // Given
            ParseTree tree = parse("cell X { cluster W { { {");

            // When
            List<String> replacements = tree.errors().stream()
                    .filter(SyntaxError::isUnclosedBlock)
                    .map(error -> engine.suggest(tree.tokens(), error).orElseThrow().fix().replacement())
                    .collect(Collectors.toList());

            // Then
            assertEquals(List.of("}}}", "}"), replacements);
        }

        @Test
        @DisplayName("Two names side by side in a flow need an arrow")
        void missingArrow() {
            // Given
            String source = "flow F { Web Api }";

            // When
            RecoverySuggestion suggestion = suggestFor(source);

            // Then
            assertEquals("missingArrow", suggestion.patternName());
            String fixed = suggestion.fix().applyTo(source);
            assertEquals("flow F { Web ->  Api }", fixed);
            assertFalse(parse(fixed).hasErrors());
        }

        @Test
        @DisplayName("A type attribute without colon gets one")
        void missingColonAfterType() {
            // Given
            String source = "cell A { microservice S [type database] }";

            // When
            RecoverySuggestion suggestion = suggestFor(source);

            // Then
            assertEquals("missingColonAfterType", suggestion.patternName());
            assertEquals("cell A { microservice S [type: database] }", suggestion.fix().applyTo(source));
        }

        @Test
        @DisplayName("A misspelled component type is corrected")
        void componentTypeTypo() {
            // Given
            String source = "cell A { components { databse Orders } }";

            // When
            RecoverySuggestion suggestion = suggestFor(source);

            // Then
            assertEquals("componentTypeTypo", suggestion.patternName());
            assertEquals("Did you mean 'database'?", suggestion.hint());
            assertEquals("database", suggestion.fix().replacement());
            assertEquals("cell A { components { database Orders } }", suggestion.fix().applyTo(source));
        }

        @Test
        @DisplayName("An unknown word far from every type only gets advice")
        void unknownComponentType() {
            // When
            RecoverySuggestion suggestion = suggestFor("cell A { components { xyz123 Orders } }");

            // Then
            assertEquals("componentTypeTypo", suggestion.patternName());
            assertFalse(suggestion.hasFix());
            assertTrue(suggestion.hint().startsWith("'xyz123' is not a valid component type"));
        }

        @Test
        @DisplayName("A misspelled cell type lists the valid ones")
        void cellTypeTypo() {
            // When
            RecoverySuggestion suggestion = suggestFor("cell A type: logc {}");

            // Then
            assertEquals("cellTypeTypo", suggestion.patternName());
            assertTrue(suggestion.hint().startsWith("Did you mean 'logic'? Valid cell types are: logic"));
            assertEquals("logic", suggestion.fix().replacement());
        }

        @Test
        @DisplayName("A port without number gets an example value")
        void missingPortNumber() {
            // Given
            String source = "cell A { microservice S [port:] }";

            // When
            RecoverySuggestion suggestion = suggestFor(source);

            // Then
            assertEquals("missingPortNumber", suggestion.patternName());
            assertEquals("Port requires a number. Example: port 8080", suggestion.hint());
            assertEquals("cell A { microservice S [port: 8080] }", suggestion.fix().applyTo(source));
        }

        @Test
        @DisplayName("A multi-word name is wrapped in quotes")
        void multiWordName() {
            // Given
            String source = "cell Order Service { }";

            // When
            RecoverySuggestion suggestion = suggestFor(source);

            // Then
            assertEquals("missingQuotes", suggestion.patternName());
            String fixed = suggestion.fix().applyTo(source);
            assertEquals("cell \"Order Service\" { }", fixed);
            assertFalse(parse(fixed).hasErrors());
        }

        @Test
        @DisplayName("A keyword used as a name is wrapped in quotes")
        void keywordAsName() {
            // When
            RecoverySuggestion suggestion = suggestFor("cell data { }");

            // Then
            assertEquals("missingQuotes", suggestion.patternName());
            assertEquals("\"data\"", suggestion.fix().replacement());
        }
    }

    // ==================== Engine ====================

    @Nested
    @DisplayName("Pattern ordering")
    class OrderingTests {

        @Mock
        private ErrorPattern first;

        @Mock
        private ErrorPattern second;

        private PatternContext context;

        @BeforeEach
        void setUp() {
            MockitoAnnotations.openMocks(this);
            context = PatternContext.at(Lexer.tokenize("cell A").tokens(), 1, null);
            when(first.name()).thenReturn("first");
            when(second.name()).thenReturn("second");
        }

        @Test
        @DisplayName("The first matching pattern wins")
        void firstMatchWins() {
            // Given
            RecoverySuggestion expected = new RecoverySuggestion("first", "from first", null);
            when(first.matches(any())).thenReturn(true);
            when(first.suggest(any())).thenReturn(expected);
            when(second.matches(any())).thenReturn(true);
            RecoveryEngine custom = new RecoveryEngine(List.of(first, second));

            // When
            Optional<RecoverySuggestion> suggestion = custom.suggest(context);

            // Then
            assertEquals(Optional.of(expected), suggestion);
            verify(second, never()).matches(any());
            verify(second, never()).suggest(any());
        }

        @Test
        @DisplayName("Non-matching patterns are skipped")
        void skipsNonMatching() {
            // Given
            RecoverySuggestion expected = new RecoverySuggestion("second", "from second", null);
            when(first.matches(any())).thenReturn(false);
            when(second.matches(any())).thenReturn(true);
            when(second.suggest(any())).thenReturn(expected);

            // When
            Optional<RecoverySuggestion> suggestion = new RecoveryEngine(List.of(first, second)).suggest(context);

            // Then
            assertEquals("from second", suggestion.orElseThrow().hint());
            verify(first, never()).suggest(any());
        }

        @Test
        @DisplayName("No match leaves the diagnostic untouched")
        void noMatchLeavesDiagnostic() {
            // Given
            ParseTree tree = parse("cell {}");
            SyntaxError error = tree.errors().get(0);
            EnhancedParseError diagnostic = DiagnosticMessages.fromSyntaxError(error, tree.tokens());
            RecoveryEngine empty = new RecoveryEngine(List.of(first));
            when(first.matches(any())).thenReturn(false);

            // When
            EnhancedParseError enhanced = empty.enhance(diagnostic, error, tree.tokens());

            // Then
            assertSame(diagnostic, enhanced);
        }
    }

    @Test
    @DisplayName("Enhancing replaces the hint and attaches the fix")
    void enhanceReplacesHint() {
        // Given
        ParseTree tree = parse("cell Orders {");
        SyntaxError error = tree.errors().get(0);
        EnhancedParseError diagnostic = DiagnosticMessages.fromSyntaxError(error, tree.tokens());

        // When
        EnhancedParseError enhanced = engine.enhance(diagnostic, error, tree.tokens());

        // Then
        assertEquals(ErrorCode.MISSING_CLOSING_BRACE, enhanced.code());
        assertEquals(diagnostic.message(), enhanced.message());
        assertEquals("Missing closing '}' for block opened at line 1", enhanced.recoveryHint());
        SuggestedFix fix = enhanced.suggestedFix();
        assertEquals("cell Orders {}", fix.applyTo("cell Orders {"));
    }

    @Test
    @DisplayName("Closest-match helpers delegate to the edit distance")
    void closestMatchHelpers() {
        assertEquals("database", RecoveryEngine.findClosestMatch("databse", DiagnosticMessages.VALID_COMPONENT_TYPES));
        assertNull(RecoveryEngine.findClosestMatch("xyz123", DiagnosticMessages.VALID_COMPONENT_TYPES));
        assertNull(RecoveryEngine.findClosestMatch("databse", DiagnosticMessages.VALID_COMPONENT_TYPES, 0));
    }
}
