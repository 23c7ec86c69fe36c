package io.github.cyfko.curatorkit.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecoveryPolicy Tests")
class RecoveryPolicyTest {

    @Test
    @DisplayName("Should enable every local stage but no external repair by default")
    void shouldBuildDefaults() {
        // When
        RecoveryPolicy policy = RecoveryPolicy.defaults();

        // Then
        assertTrue(policy.regexRepairEnabled());
        assertTrue(policy.tolerantParseEnabled());
        assertFalse(policy.externalRepairEnabled(), "External repair should be opt-in");
    }

    @Test
    @DisplayName("Should disable every recovery stage in strict mode")
    void shouldBuildStrictOnly() {
        assertEquals(new RecoveryPolicy(false, false, false), RecoveryPolicy.strictOnly());
    }

    @Test
    @DisplayName("Should enable every stage when external repair is requested")
    void shouldBuildWithExternalRepair() {
        assertEquals(new RecoveryPolicy(true, true, true), RecoveryPolicy.withExternalRepair());
    }
}
