package com.ryuqq.promotion.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Environment 테스트.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class EnvironmentTest {

    @Test
    void parse_LowerCaseValue_ReturnsEnvironment() {
        assertEquals(Environment.STAGE, Environment.parse("stage").orElseThrow());
    }

    @Test
    void parse_MixedCaseWithWhitespace_ReturnsEnvironment() {
        // When
        Environment environment = Environment.parse("  PrOd ").orElseThrow();

        // Then
        assertEquals(Environment.PROD, environment);
    }

    @Test
    void parse_UnknownValue_ReturnsEmpty() {
        assertTrue(Environment.parse("qa").isEmpty());
        assertTrue(Environment.parse("production").isEmpty());
    }

    @Test
    void parse_NullOrBlank_ReturnsEmpty() {
        assertTrue(Environment.parse(null).isEmpty());
        assertTrue(Environment.parse("   ").isEmpty());
    }

    @Test
    void of_UnknownValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Environment.of("qa")
        );
        assertTrue(exception.getMessage().contains("Unknown environment"));
    }

    @Test
    void toString_ReturnsWireValue() {
        assertEquals("dev", Environment.DEV.toString());
        assertEquals("test", Environment.TEST.value());
    }
}
