package io.github.cyfko.curatorkit.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Presets, builder defaults and validation of {@link ParserPolicy}.
 */
@DisplayName("ParserPolicy Tests")
class ParserPolicyTest {

    // ============================================================================
    // Presets
    // ============================================================================

    @Test
    @DisplayName("Should tolerate trailing commas by default")
    void shouldBuildDefaults() {
        // When
        ParserPolicy policy = ParserPolicy.defaults();

        // Then
        assertEquals("DEFAULT_POLICY", policy.policyName());
        assertEquals(200_000, policy.maxInputLength());
        assertEquals(256, policy.maxDepth());
        assertTrue(policy.allowTrailingComma(), "Default policy should accept trailing commas");
        assertSame(PatternConfig.IDENTIFIER_PATTERN, policy.identifierPattern());
    }

    @Test
    @DisplayName("Should reject trailing commas and shrink limits in strict mode")
    void shouldBuildStrict() {
        // When
        ParserPolicy policy = ParserPolicy.strict();

        // Then
        assertEquals("STRICT_POLICY", policy.policyName());
        assertEquals(20_000, policy.maxInputLength());
        assertEquals(64, policy.maxDepth());
        assertFalse(policy.allowTrailingComma(), "Strict policy should reject trailing commas");
    }

    @Test
    @DisplayName("Should raise limits in relaxed mode")
    void shouldBuildRelaxed() {
        // When
        ParserPolicy policy = ParserPolicy.relaxed();

        // Then
        assertEquals(5_000_000, policy.maxInputLength());
        assertEquals(1024, policy.maxDepth());
        assertTrue(policy.allowTrailingComma());
    }

    // ============================================================================
    // Builder
    // ============================================================================

    @Test
    @DisplayName("Should start the builder from the default limits")
    void shouldStartBuilderFromDefaults() {
        // When
        ParserPolicy policy = ParserPolicy.builder().build();

        // Then
        assertEquals("CUSTOM_POLICY", policy.policyName());
        assertEquals(ParserPolicy.defaults().maxInputLength(), policy.maxInputLength());
        assertEquals(ParserPolicy.defaults().maxDepth(), policy.maxDepth());
        assertTrue(policy.allowTrailingComma());
    }

    @Test
    @DisplayName("Should apply custom values")
    void shouldApplyCustomValues() {
        // Given
        Pattern upperCase = Pattern.compile("^[A-Z_]+$");

        // When
        ParserPolicy policy = ParserPolicy.builder()
                .policyName("rules")
                .maxInputLength(500)
                .maxDepth(8)
                .identifierPattern(upperCase)
                .allowTrailingComma(false)
                .build();

        // Then
        assertEquals("rules", policy.policyName());
        assertEquals(500, policy.maxInputLength());
        assertEquals(8, policy.maxDepth());
        assertSame(upperCase, policy.identifierPattern());
        assertFalse(policy.allowTrailingComma());
    }

    // ============================================================================
    // Validation
    // ============================================================================

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Should reject non-positive limits")
    void shouldRejectNonPositiveLimits(int limit) {
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().maxDepth(limit).build());
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().maxInputLength(limit).build());
    }

    @Test
    @DisplayName("Should require a name and an identifier pattern")
    void shouldRequireNameAndPattern() {
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().policyName(" ").build());
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().identifierPattern(null).build());
    }

    @ParameterizedTest
    @ValueSource(strings = {"age", "_private", "HAS_X_2", "histology_type"})
    @DisplayName("Should accept well-formed identifiers")
    void shouldAcceptIdentifiers(String identifier) {
        assertTrue(PatternConfig.IDENTIFIER_PATTERN.matcher(identifier).matches());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2fast", "has-dash", "with space", ""})
    @DisplayName("Should reject malformed identifiers")
    void shouldRejectIdentifiers(String identifier) {
        assertFalse(PatternConfig.IDENTIFIER_PATTERN.matcher(identifier).matches());
    }
}
