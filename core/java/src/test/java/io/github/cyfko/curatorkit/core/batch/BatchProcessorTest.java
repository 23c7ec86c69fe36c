package io.github.cyfko.curatorkit.core.batch;

import io.github.cyfko.curatorkit.core.exception.DSLSyntaxException;
import io.github.cyfko.curatorkit.core.exception.JsonRecoveryException;
import io.github.cyfko.curatorkit.core.exception.LookupDefinitionException;
import io.github.cyfko.curatorkit.core.exception.OntologyDefinitionException;
import io.github.cyfko.curatorkit.core.exception.TreeInvariantException;
import io.github.cyfko.curatorkit.core.impl.CriterionDslParser;
import io.github.cyfko.curatorkit.core.model.Document;
import io.github.cyfko.curatorkit.core.tree.TreePruner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static io.github.cyfko.curatorkit.core.model.Criteria.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BatchProcessor Tests")
class BatchProcessorTest {

    @Mock
    private Consumer<Document> step;

    private static Map<String, String> texts(String... idsAndTexts) {
        Map<String, String> texts = new LinkedHashMap<>();
        for (int i = 0; i < idsAndTexts.length; i += 2) {
            texts.put(idsAndTexts[i], idsAndTexts[i + 1]);
        }
        return texts;
    }

    @Nested
    @DisplayName("Processing texts")
    class ProcessingTexts {

        @Test
        @DisplayName("Should skip a document that fails to parse and keep the others")
        void shouldIsolateSyntaxErrors() {
            // Given
            BatchProcessor processor = BatchProcessor.builder().build();
            Map<String, String> inputs = texts(
                    "NCT01", "age(min=18)",
                    "NCT02", "and{age(",
                    "NCT03", "not{histology(histology_type=\"sarcomatoid\")}");

            // When
            BatchReport report = processor.process(inputs, BatchProcessor.parsing(new CriterionDslParser()));

            // Then
            assertEquals(3, report.processed());
            assertEquals(List.of("NCT01", "NCT03"), report.successes().stream().map(Document::id).toList());
            assertTrue(report.hasFailures());
            assertEquals(1, report.failures().size());
            BatchReport.Failure failure = report.failures().get(0);
            assertEquals("NCT02", failure.documentId());
            assertEquals(FailureKind.SYNTAX, failure.kind());
            assertNotNull(failure.message());
        }

        @Test
        @DisplayName("Should keep the input text as the rule text")
        void shouldKeepRuleText() {
            // Given
            BatchProcessor processor = BatchProcessor.builder().build();

            // When
            BatchReport report = processor.process(texts("NCT01", "a(), b()"),
                    BatchProcessor.parsing(new CriterionDslParser()));

            // Then
            Document document = report.successes().get(0);
            assertEquals("a(), b()", document.ruleText());
            assertEquals(List.of(leaf("a"), leaf("b")), document.roots());
        }

        @Test
        @DisplayName("Should report documents left without roots as discardable")
        void shouldReportDiscardable() {
            // Given
            BatchProcessor processor = BatchProcessor.builder()
                    .step(document -> TreePruner.pruneDocument(document, Set.of("histology")))
                    .build();
            Map<String, String> inputs = texts(
                    "NCT01", "and{age(min=18), histology(histology_type=\"sarcomatoid\")}",
                    "NCT02", "age(min=18)");

            // When
            BatchReport report = processor.process(inputs, BatchProcessor.parsing(new CriterionDslParser()));

            // Then
            assertFalse(report.hasFailures());
            assertEquals(List.of("NCT02"), report.discardable());
            assertEquals(1, report.retained().size());
            assertEquals("NCT01", report.retained().get(0).id());
            assertEquals(List.of(and(leaf("histology", "histology_type", "sarcomatoid"))),
                    report.retained().get(0).roots());
        }
    }

    @Nested
    @DisplayName("Applying steps")
    class ApplyingSteps {

        @Test
        @DisplayName("Should run every step on every document in order")
        void shouldRunStepsInOrder() {
            // Given
            Document first = new Document("NCT01", leaf("a"));
            Document second = new Document("NCT02", leaf("b"));
            BatchProcessor processor = BatchProcessor.builder().step(step).build();

            // When
            BatchReport report = processor.apply(List.of(first, second));

            // Then
            InOrder inOrder = inOrder(step);
            inOrder.verify(step).accept(first);
            inOrder.verify(step).accept(second);
            assertEquals(List.of(first, second), report.successes());
        }

        @Test
        @DisplayName("Should stop the steps of a failing document and move on")
        void shouldIsolateStepFailures() {
            // Given
            Document broken = new Document("NCT01", leaf("a"));
            Document fine = new Document("NCT02", leaf("b"));
            Consumer<Document> failing = document -> {
                if (document == broken) {
                    throw new TreeInvariantException("Cycle detected");
                }
            };
            BatchProcessor processor = BatchProcessor.builder().step(failing).step(step).build();

            // When
            BatchReport report = processor.apply(List.of(broken, fine));

            // Then
            verify(step, never()).accept(broken);
            verify(step).accept(fine);
            assertEquals(List.of(fine), report.successes());
            assertEquals(List.of(new BatchReport.Failure("NCT01", FailureKind.TREE_INVARIANT, "Cycle detected")),
                    report.failures());
            assertEquals(1, report.failures(FailureKind.TREE_INVARIANT).size());
            assertTrue(report.failures(FailureKind.SYNTAX).isEmpty());
        }

        @Test
        @DisplayName("Should let programming errors propagate")
        void shouldPropagateOtherExceptions() {
            // Given
            doThrow(new IllegalStateException("bug")).when(step).accept(any());
            BatchProcessor processor = BatchProcessor.builder().step(step).build();
            List<Document> documents = List.of(new Document("NCT01", leaf("a")));

            // When & Then
            IllegalStateException error = assertThrows(IllegalStateException.class, () -> processor.apply(documents));
            assertEquals("bug", error.getMessage());
        }

        @Test
        @DisplayName("Should reject a null step")
        void shouldRejectNullStep() {
            assertThrows(NullPointerException.class, () -> BatchProcessor.builder().step(null));
        }
    }

    @Nested
    @DisplayName("Failure kinds")
    class FailureKinds {

        @Test
        @DisplayName("Should map each exception type to its category")
        void shouldCategorizeExceptions() {
            assertEquals(FailureKind.SYNTAX, FailureKind.of(new DSLSyntaxException("x")));
            assertEquals(FailureKind.TREE_INVARIANT, FailureKind.of(new TreeInvariantException("x")));
            assertEquals(FailureKind.JSON_RECOVERY, FailureKind.of(new JsonRecoveryException("x", List.of())));
            assertEquals(FailureKind.ONTOLOGY, FailureKind.of(new OntologyDefinitionException("x")));
            assertEquals(FailureKind.LOOKUP, FailureKind.of(new LookupDefinitionException("x")));
        }
    }
}
