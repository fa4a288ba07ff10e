package io.github.cyfko.celldl.core.lexer;

import io.github.cyfko.celldl.core.diagnostics.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Lexer")
class LexerTest {

    private static List<TokenKind> kinds(String source) {
        return Lexer.tokenize(source).tokens().stream().map(Token::kind).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Keywords")
    class KeywordTests {

        @ParameterizedTest
        @CsvSource({
                "cells, CELLS",
                "cell, CELL",
                "userstore, USERSTORE",
                "user, USER",
                "database, DATABASE",
                "data, DATA",
                "local-sts, LOCAL_STS",
                "ms, MS",
                "northbound, NORTHBOUND"
        })
        @DisplayName("Should read the longest keyword")
        void shouldReadLongestKeyword(String word, TokenKind expected) {
            // When
            List<TokenKind> kinds = kinds(word);

            // Then
            assertEquals(List.of(expected), kinds);
        }

        @Test
        @DisplayName("Keyword prefixes inside a longer word stay identifiers")
        void keywordPrefixesStayIdentifiers() {
            // When
            LexResult result = Lexer.tokenize("users cellar api-gw");

            // Then
            assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.IDENTIFIER),
                    result.tokens().stream().map(Token::kind).collect(Collectors.toList()));
            assertEquals("api-gw", result.tokens().get(2).image());
        }

        @Test
        @DisplayName("Structural keywords ignore case, type vocabularies do not")
        void caseSensitivitySplit() {
            // When
            List<TokenKind> kinds = kinds("CELL Gateway Database LOGIC logic");

            // Then
            assertEquals(List.of(TokenKind.CELL, TokenKind.GATEWAY, TokenKind.IDENTIFIER,
                    TokenKind.IDENTIFIER, TokenKind.LOGIC), kinds);
        }
    }

    @Nested
    @DisplayName("Literals and punctuation")
    class LiteralTests {

        @Test
        @DisplayName("An arrow ends the word before it")
        void arrowEndsWord() {
            // When
            List<TokenKind> kinds = kinds("a->b");

            // Then
            assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.ARROW, TokenKind.IDENTIFIER), kinds);
        }

        @Test
        @DisplayName("Should read signed and decimal numbers")
        void shouldReadNumbers() {
            // When
            LexResult result = Lexer.tokenize("port 8080 -42 3.14");

            // Then
            assertFalse(result.hasErrors());
            List<Token> tokens = result.tokens();
            assertEquals(4, tokens.size());
            assertEquals("8080", tokens.get(1).image());
            assertEquals("-42", tokens.get(2).image());
            assertEquals("3.14", tokens.get(3).image());
            assertTrue(tokens.subList(1, 4).stream().allMatch(t -> t.is(TokenKind.NUMBER)));
        }

        @Test
        @DisplayName("A string token keeps its quotes in the image")
        void stringKeepsQuotes() {
            // When
            List<Token> tokens = Lexer.tokenize("label \"Order \\\"Service\\\"\"").tokens();

            // Then
            assertEquals(2, tokens.size());
            assertEquals(TokenKind.STRING, tokens.get(1).kind());
            assertEquals("\"Order \\\"Service\\\"\"", tokens.get(1).image());
        }

        @Test
        @DisplayName("Should emit every punctuation kind")
        void shouldEmitPunctuation() {
            // When
            List<TokenKind> kinds = kinds("{ } [ ] ( ) : , = . ->");

            // Then
            assertEquals(List.of(TokenKind.LBRACE, TokenKind.RBRACE, TokenKind.LBRACKET, TokenKind.RBRACKET,
                    TokenKind.LPAREN, TokenKind.RPAREN, TokenKind.COLON, TokenKind.COMMA,
                    TokenKind.EQUALS, TokenKind.DOT, TokenKind.ARROW), kinds);
        }
    }

    @Nested
    @DisplayName("Positions and trivia")
    class PositionTests {

        @Test
        @DisplayName("Comments are skipped but positions account for them")
        void commentsAreSkipped() {
            // Given
            String source = "// header\ncell /* inline */ Orders";

            // When
            List<Token> tokens = Lexer.tokenize(source).tokens();

            // Then
            assertEquals(2, tokens.size());
            Token cell = tokens.get(0);
            assertEquals(2, cell.line());
            assertEquals(1, cell.column());
            assertEquals(10, cell.offset());

            Token name = tokens.get(1);
            assertEquals(2, name.line());
            assertEquals(19, name.column());
            assertEquals(source.indexOf("Orders"), name.offset());
            assertEquals(6, name.length());
            assertEquals(name.offset() + 6, name.endOffset());
        }

        @Test
        @DisplayName("CRLF counts as one line break")
        void crlfCountsOnce() {
            // When
            List<Token> tokens = Lexer.tokenize("cell\r\n\r\nOrders").tokens();

            // Then
            assertEquals(3, tokens.get(1).line());
            assertEquals(1, tokens.get(1).column());
        }

        @Test
        @DisplayName("Empty and null sources give no tokens")
        void emptySources() {
            assertTrue(Lexer.tokenize("").tokens().isEmpty());
            assertTrue(Lexer.tokenize(null).tokens().isEmpty());
            assertTrue(Lexer.tokenize("   // only a comment").tokens().isEmpty());
        }
    }

    @Nested
    @DisplayName("Lexical errors")
    class ErrorTests {

        @Test
        @DisplayName("An unterminated string is reported and dropped")
        void unterminatedString() {
            // When
            LexResult result = Lexer.tokenize("label \"abc\ncell");

            // Then
            assertEquals(1, result.errors().size());
            LexError error = result.errors().get(0);
            assertEquals(ErrorCode.UNTERMINATED_STRING, error.code());
            assertEquals(1, error.line());
            assertEquals(7, error.column());
            assertEquals(List.of(TokenKind.LABEL, TokenKind.CELL),
                    result.tokens().stream().map(Token::kind).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Unknown characters are reported and scanning resumes")
        void unexpectedCharacter() {
            // When
            LexResult result = Lexer.tokenize("cell @# Orders");

            // Then
            assertEquals(1, result.errors().size());
            assertEquals(ErrorCode.UNEXPECTED_CHARACTER, result.errors().get(0).code());
            assertEquals(2, result.errors().get(0).length());
            assertEquals(List.of(TokenKind.CELL, TokenKind.IDENTIFIER),
                    result.tokens().stream().map(Token::kind).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("A number glued to letters is invalid")
        void invalidNumber() {
            // When
            LexResult result = Lexer.tokenize("port 8080abc");

            // Then
            assertEquals(ErrorCode.INVALID_NUMBER, result.errors().get(0).code());
            assertEquals(1, result.tokens().size());
        }

        @Test
        @DisplayName("A bad escape is reported but the string is kept")
        void invalidEscape() {
            // When
            LexResult result = Lexer.tokenize("\"a\\qb\"");

            // Then
            assertEquals(ErrorCode.INVALID_ESCAPE_SEQUENCE, result.errors().get(0).code());
            assertEquals(TokenKind.STRING, result.tokens().get(0).kind());
        }

        @Test
        @DisplayName("An unterminated block comment is reported")
        void unterminatedBlockComment() {
            // When
            LexResult result = Lexer.tokenize("cell /* never closed");

            // Then
            assertEquals(1, result.errors().size());
            assertEquals(1, result.tokens().size());
        }
    }
}
