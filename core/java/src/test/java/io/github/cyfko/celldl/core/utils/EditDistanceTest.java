package io.github.cyfko.celldl.core.utils;

import io.github.cyfko.celldl.core.diagnostics.DiagnosticMessages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EditDistance")
class EditDistanceTest {

    @ParameterizedTest
    @CsvSource({
            "kitten, sitting, 3",
            "database, databse, 1",
            "logic, logic, 0",
            "'', abc, 3",
            "abc, '', 3"
    })
    @DisplayName("Should compute the Levenshtein distance")
    void shouldComputeDistance(String a, String b, int expected) {
        assertEquals(expected, EditDistance.levenshtein(a, b));
        assertEquals(expected, EditDistance.levenshtein(b, a));
    }

    @Test
    @DisplayName("Should suggest the closest component type")
    void shouldSuggestClosestComponentType() {
        // When
        String match = EditDistance.findClosestMatch("databse", DiagnosticMessages.VALID_COMPONENT_TYPES);

        // Then
        assertEquals("database", match);
    }

    @Test
    @DisplayName("Comparison ignores case")
    void comparisonIgnoresCase() {
        assertEquals("microservice", EditDistance.findClosestMatch("MicroServce", List.of("microservice", "function")));
    }

    @Test
    @DisplayName("Nothing is suggested beyond the maximum distance")
    void nothingBeyondMaxDistance() {
        // When / Then
        assertNull(EditDistance.findClosestMatch("xyz123", DiagnosticMessages.VALID_COMPONENT_TYPES));
        assertNull(EditDistance.findClosestMatch("logik", List.of("logic"), 0));
        assertEquals("logic", EditDistance.findClosestMatch("logik", List.of("logic"), 1));
    }

    @Test
    @DisplayName("The first candidate wins a tie")
    void firstCandidateWinsTie() {
        assertEquals("cache", EditDistance.findClosestMatch("cachf", List.of("cache", "cachx")));
    }
}
