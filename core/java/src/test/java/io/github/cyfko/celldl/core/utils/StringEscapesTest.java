package io.github.cyfko.celldl.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StringEscapes")
class StringEscapesTest {

    @Test
    @DisplayName("Should remove quotes and resolve escapes")
    void shouldUnquote() {
        assertEquals("Order Service", StringEscapes.unquote("\"Order Service\""));
        assertEquals("a\"b\\c\nd\te", StringEscapes.unquote("\"a\\\"b\\\\c\\nd\\te\""));
    }

    @Test
    @DisplayName("An unknown escape keeps the escaped character")
    void unknownEscape() {
        assertEquals("aqb", StringEscapes.unescape("a\\qb"));
    }

    @Test
    @DisplayName("An image missing its closing quote is still unquoted")
    void missingClosingQuote() {
        assertEquals("abc", StringEscapes.unquote("\"abc"));
    }

    @Test
    @DisplayName("Quoting escapes what unquoting resolves")
    void quoteIsInverseOfUnquote() {
        // Given
        String value = "say \"hi\"\\\r\n\tbye";

        // When
        String literal = StringEscapes.quote(value);

        // Then
        assertEquals("\"say \\\"hi\\\"\\\\\\r\\n\\tbye\"", literal);
        assertEquals(value, StringEscapes.unquote(literal));
    }
}
