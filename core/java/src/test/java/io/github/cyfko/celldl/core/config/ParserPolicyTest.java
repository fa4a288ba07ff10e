package io.github.cyfko.celldl.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParserPolicy")
class ParserPolicyTest {

    @Test
    @DisplayName("Presets carry their documented limits")
    void presets() {
        assertEquals(1_000_000, ParserPolicy.defaults().maxSourceLength());
        assertTrue(ParserPolicy.defaults().recoveryEnabled());
        assertEquals("DEFAULT_POLICY", ParserPolicy.defaults().policyName());

        assertEquals(100_000, ParserPolicy.strict().maxSourceLength());
        assertFalse(ParserPolicy.strict().recoveryEnabled());

        assertEquals(10_000_000, ParserPolicy.relaxed().maxSourceLength());
        assertTrue(ParserPolicy.relaxed().recoveryEnabled());
    }

    @Test
    @DisplayName("The builder starts from the default limits")
    void builder() {
        // When
        ParserPolicy policy = ParserPolicy.builder()
                .maxSourceLength(500)
                .recoveryEnabled(false)
                .build();

        // Then
        assertEquals(ParserPolicy.PolicyName.CUSTOM_POLICY.name(), policy.policyName());
        assertEquals(500, policy.maxSourceLength());
        assertFalse(policy.recoveryEnabled());
        assertEquals(1_000_000, ParserPolicy.builder().build().maxSourceLength());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
    @DisplayName("Non-positive length limits are rejected")
    void rejectsNonPositiveLimit(int limit) {
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().maxSourceLength(limit).build());
    }

    @Test
    @DisplayName("A policy needs a name")
    void requiresName() {
        assertThrows(IllegalArgumentException.class, () -> new ParserPolicy(" ", 10, true));
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().policyName(null).build());
    }
}
