package io.github.cyfko.celldl.core.diagnostics;

import io.github.cyfko.celldl.core.lexer.LexError;
import io.github.cyfko.celldl.core.lexer.Lexer;
import io.github.cyfko.celldl.core.lexer.TokenKind;
import io.github.cyfko.celldl.core.parsing.GrammarParser;
import io.github.cyfko.celldl.core.parsing.ParseTree;
import io.github.cyfko.celldl.core.parsing.SyntaxError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DiagnosticMessages")
class DiagnosticMessagesTest {

    private static EnhancedParseError single(String source) {
        ParseTree tree = GrammarParser.parse(Lexer.tokenize(source).tokens());
        assertEquals(1, tree.errors().size(), () -> "Expected one error, got " + tree.errors());
        return DiagnosticMessages.fromSyntaxError(tree.errors().get(0), tree.tokens());
    }

    @Nested
    @DisplayName("Expected token wording")
    class ExpectedTokenTests {

        @Test
        @DisplayName("Literal kinds read as nouns")
        void literalKindsReadAsNouns() {
            assertEquals("an identifier", DiagnosticMessages.displayName(TokenKind.IDENTIFIER));
            assertEquals("end of input", DiagnosticMessages.displayName(TokenKind.EOF));
            assertEquals("'{'", DiagnosticMessages.displayName(TokenKind.LBRACE));
            assertEquals("'cell'", DiagnosticMessages.displayName(TokenKind.CELL));
        }

        @Test
        @DisplayName("Alternatives are joined with commas and a final 'or'")
        void alternativesAreJoined() {
            assertEquals("", DiagnosticMessages.formatExpectedTokens(List.of()));
            assertEquals("'{'", DiagnosticMessages.formatExpectedTokens(List.of(TokenKind.LBRACE)));
            assertEquals("'{' or '}'",
                    DiagnosticMessages.formatExpectedTokens(List.of(TokenKind.LBRACE, TokenKind.RBRACE)));
            assertEquals("'{', '}', or ':'",
                    DiagnosticMessages.formatExpectedTokens(List.of(TokenKind.LBRACE, TokenKind.RBRACE, TokenKind.COLON)));
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrorTests {

        @Test
        @DisplayName("An unclosed block points at its opening brace")
        void unclosedBlock() {
            // When
            EnhancedParseError error = single("cell Orders {");

            // Then
            assertEquals(ErrorCode.MISSING_CLOSING_BRACE, error.code());
            assertEquals("Missing closing '}' for block started at line 1", error.message());
            assertEquals(1, error.line());
            assertEquals(13, error.column());
            assertEquals(12, error.offset());
            assertNull(error.actualToken());
            assertEquals(List.of("cell", "Orders", "{"), error.previousTokens());
        }

        @Test
        @DisplayName("An unknown cell type lists the valid ones")
        void invalidCellType() {
            // When
            EnhancedParseError error = single("cell A type: logik {}");

            // Then
            assertEquals(ErrorCode.INVALID_CELL_TYPE, error.code());
            assertEquals("'logik' is not a valid cell type", error.message());
            assertTrue(error.recoveryHint().contains("logic, integration, data"));
            assertEquals("cellType", error.ruleName());
            assertEquals("logik", error.actualToken());
        }

        @Test
        @DisplayName("A missing type value is worded as expected, not as invalid")
        void missingCellType() {
            // When
            EnhancedParseError error = single("cell A { type: }");

            // Then
            assertEquals(ErrorCode.INVALID_CELL_TYPE, error.code());
            assertEquals("Expected a cell type, but found '}'", error.message());
            assertTrue(error.recoveryHint().contains("logic, integration, data"));
        }

        @Test
        @DisplayName("A missing name asks for an identifier or a string")
        void missingName() {
            // When
            EnhancedParseError error = single("cell {}");

            // Then
            assertEquals(ErrorCode.MISSING_IDENTIFIER, error.code());
            assertTrue(error.message().startsWith("Expected a name (identifier or string)"));
            assertTrue(error.expectedTokens().contains("an identifier"));
        }

        @Test
        @DisplayName("A missing comma is only a warning")
        void missingCommaIsWarning() {
            // When
            EnhancedParseError error = single("cell A { microservice S [port: 1 protocol: https] }");

            // Then
            assertEquals(ErrorCode.MISSING_COMMA, error.code());
            assertEquals(ErrorSeverity.WARNING, error.severity());
            assertFalse(error.isError());
        }

        @Test
        @DisplayName("Content after the wrapper is redundant input")
        void redundantInput() {
            // When
            EnhancedParseError error = single("diagram D { cell A {} }\ncell B {}");

            // Then
            assertEquals(ErrorCode.REDUNDANT_INPUT, error.code());
            assertEquals(4014, error.code().code());
            assertEquals(ErrorSeverity.WARNING, error.severity());
            assertEquals(2, error.line());
        }

        @Test
        @DisplayName("An empty flow needs one statement")
        void emptyFlow() {
            // When
            EnhancedParseError error = single("flow F { }");

            // Then
            assertEquals(ErrorCode.EARLY_EXIT, error.code());
            assertEquals("Expected at least one flow statement, but found '}'", error.message());
        }

        @Test
        @DisplayName("The code mapping matches the full conversion")
        void codeForMatchesConversion() {
            // Given
            ParseTree tree = GrammarParser.parse(Lexer.tokenize("cell A { microservice S [port 1] }").tokens());
            SyntaxError error = tree.errors().get(0);

            // When / Then
            assertEquals(ErrorCode.MISSING_COLON, DiagnosticMessages.codeFor(error));
            assertEquals(DiagnosticMessages.codeFor(error),
                    DiagnosticMessages.fromSyntaxError(error, tree.tokens()).code());
        }
    }

    @Test
    @DisplayName("Only unterminated strings get a lexical hint")
    void lexicalHints() {
        // Given
        LexError unterminated = new LexError(ErrorCode.UNTERMINATED_STRING, "Unterminated string literal", 1, 7, 6, 4);
        LexError illegal = new LexError(ErrorCode.UNEXPECTED_CHARACTER, "Unexpected character '@'", 2, 1, 12, 1);

        // When
        EnhancedParseError first = DiagnosticMessages.fromLexError(unterminated);
        EnhancedParseError second = DiagnosticMessages.fromLexError(illegal);

        // Then
        assertNotNull(first.recoveryHint());
        assertEquals(ErrorCategory.LEXICAL, first.category());
        assertEquals(11, first.endColumn());
        assertNull(second.recoveryHint());
        assertEquals(2, second.line());
    }
}
