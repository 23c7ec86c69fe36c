package io.github.cyfko.curatorkit.core.json;

import io.github.cyfko.curatorkit.core.api.LlmJsonRepairer;
import io.github.cyfko.curatorkit.core.config.RecoveryPolicy;
import io.github.cyfko.curatorkit.core.exception.JsonRecoveryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JsonRecoveryPipeline Tests")
class JsonRecoveryPipelineTest {

    private static final String UNPARSEABLE = "not json at all";

    @Mock
    private LlmJsonRepairer repairer;

    @Nested
    @DisplayName("Local stages")
    class LocalStages {

        private final JsonRecoveryPipeline pipeline = new JsonRecoveryPipeline();

        @Test
        @DisplayName("Should parse valid JSON in the strict stage")
        void shouldUseStrictStage() {
            // When
            RecoveryResult result = pipeline.recover("{\"IS_MALE\": [], \"n\": 3}");

            // Then
            assertTrue(result.isSuccess());
            assertEquals(JsonRecoveryPipeline.STRICT, result.getStage());
            assertEquals(Map.of("IS_MALE", List.of(), "n", 3L), result.getValue());
            assertTrue(result.getWarnings().isEmpty());
            assertTrue(result.getStageErrors().isEmpty());
        }

        @Test
        @DisplayName("Should succeed with the JSON null literal")
        void shouldAcceptNullLiteral() {
            RecoveryResult result = pipeline.recover("null");

            assertTrue(result.isSuccess());
            assertNull(result.getValue());
        }

        @Test
        @DisplayName("Should fall back to the textual repair")
        void shouldUseRegexRepairStage() {
            RecoveryResult result = pipeline.recover("{\"actin_rule\": { \"IS_MALE\" },}");

            assertEquals(JsonRecoveryPipeline.REGEX_REPAIR, result.getStage());
            assertEquals(Map.of("actin_rule", "IS_MALE"), result.getValue());
            assertEquals(1, result.getStageErrors().size());
            assertTrue(result.getStageErrors().get(0).startsWith("strict: "));
            assertFalse(result.getWarnings().isEmpty());
        }

        @Test
        @DisplayName("Should repair a power with a huge exponent without stalling")
        void shouldRepairHugePower() {
            RecoveryResult result = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> pipeline.recover("{\"a\": 0**99999999999999}"));

            assertTrue(result.isSuccess());
            assertEquals(Map.of("a", 0L), result.getValue());
        }

        @Test
        @DisplayName("Should fall back to the tolerant parser")
        void shouldUseTolerantStage() {
            // Given: the first object misses its closing brace, which no textual repair restores
            String text = "[{\"a\": 1, {\"b\": 2}]";

            // When
            RecoveryResult result = pipeline.recover(text);

            // Then
            assertEquals(JsonRecoveryPipeline.TOLERANT, result.getStage());
            assertEquals(List.of(Map.of("a", 1L), Map.of("b", 2L)), result.getValue());
            assertEquals(2, result.getStageErrors().size());
            assertTrue(result.getWarnings().get(0).startsWith("Missing '}'"));
        }

        @Test
        @DisplayName("Should report every stage error when nothing recovers")
        void shouldReportAllErrors() {
            RecoveryResult result = pipeline.recover(UNPARSEABLE);

            assertFalse(result.isSuccess());
            assertNull(result.getStage());
            assertEquals(3, result.getStageErrors().size());
            assertTrue(result.getStageErrors().get(2).startsWith("tolerant: "));
        }

        @Test
        @DisplayName("Should only try the strict stage under the strict-only policy")
        void shouldHonourStrictOnly() {
            JsonRecoveryPipeline strict = new JsonRecoveryPipeline(RecoveryPolicy.strictOnly());

            JsonRecoveryException e = assertThrows(JsonRecoveryException.class, () -> strict.parseOrThrow("{\"a\": 1,}"));

            assertEquals("Unable to recover JSON from model output", e.getMessage());
            assertEquals(1, e.stageErrors().size());
        }

        @Test
        @DisplayName("Should reject null text")
        void shouldRejectNullText() {
            assertThrows(NullPointerException.class, () -> pipeline.recover(null));
        }
    }

    @Nested
    @DisplayName("External repair")
    class ExternalRepair {

        @Test
        @DisplayName("Should hand the text and the local errors to the repairer")
        void shouldUseRepairer() {
            // Given
            when(repairer.repair(eq(UNPARSEABLE), anyString())).thenReturn("{\"IS_MALE\": []}");
            JsonRecoveryPipeline pipeline = new JsonRecoveryPipeline(RecoveryPolicy.withExternalRepair(), repairer);

            // When
            Object value = pipeline.parseOrThrow(UNPARSEABLE);

            // Then
            assertEquals(Map.of("IS_MALE", List.of()), value);
            verify(repairer).repair(eq(UNPARSEABLE), argThat(summary ->
                    summary.contains("strict: ") && summary.contains("regex-repair: ") && summary.contains("tolerant: ")));
        }

        @Test
        @DisplayName("Should not call the repairer when a local stage succeeds")
        void shouldNotCallRepairerNeedlessly() {
            JsonRecoveryPipeline pipeline = new JsonRecoveryPipeline(RecoveryPolicy.withExternalRepair(), repairer);

            RecoveryResult result = pipeline.recover("[1+1]");

            assertEquals(List.of(2L), result.getValue());
            verify(repairer, never()).repair(anyString(), anyString());
        }

        @Test
        @DisplayName("Should fail when the repaired text is still not JSON")
        void shouldFailOnBadRepair() {
            when(repairer.repair(anyString(), anyString())).thenReturn("still broken");
            JsonRecoveryPipeline pipeline = new JsonRecoveryPipeline(RecoveryPolicy.withExternalRepair(), repairer);

            RecoveryResult result = pipeline.recover(UNPARSEABLE);

            assertFalse(result.isSuccess());
            assertEquals(4, result.getStageErrors().size());
            assertTrue(result.getStageErrors().get(3).startsWith("external-repair: "));
        }

        @Test
        @DisplayName("Should fail when the repairer returns nothing")
        void shouldFailOnNullRepair() {
            when(repairer.repair(anyString(), anyString())).thenReturn(null);
            JsonRecoveryPipeline pipeline = new JsonRecoveryPipeline(RecoveryPolicy.withExternalRepair(), repairer);

            RecoveryResult result = pipeline.recover(UNPARSEABLE);

            assertEquals("external-repair: External repairer returned no text", result.getStageErrors().get(3));
        }

        @Test
        @DisplayName("Should require a repairer when external repair is enabled")
        void shouldRequireRepairer() {
            assertThrows(IllegalArgumentException.class,
                    () -> new JsonRecoveryPipeline(RecoveryPolicy.withExternalRepair()));
        }
    }
}
