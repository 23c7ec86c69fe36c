package io.github.cyfko.curatorkit.core.batch;

import io.github.cyfko.curatorkit.core.api.DslParser;
import io.github.cyfko.curatorkit.core.exception.CuratorException;
import io.github.cyfko.curatorkit.core.exception.TreeInvariantException;
import io.github.cyfko.curatorkit.core.model.Document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the same steps over many documents, isolating failures per document.
 * <p>
 * A {@link CuratorException} raised while building or rewriting one document is logged with
 * the document id (SEVERE for a {@link TreeInvariantException}, WARNING otherwise), recorded
 * in the {@link BatchReport}, and the run moves on to the next document. Any other exception
 * is a programming error and propagates.
 * </p>
 *
 * <pre>{@code
 * BatchProcessor processor = BatchProcessor.builder()
 *         .step(document -> TreePruner.pruneDocument(document, Set.of("histology")))
 *         .step(overwriter::overwrite)
 *         .build();
 * BatchReport report = processor.process(textsById, BatchProcessor.parsing(new CriterionDslParser()));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class BatchProcessor {

    private static final Logger log = Logger.getLogger(BatchProcessor.class.getName());

    private final List<Consumer<Document>> steps;

    private BatchProcessor(List<Consumer<Document>> steps) {
        this.steps = List.copyOf(steps);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Document factory parsing each input text as a forest; the text is kept as the rule text.
     *
     * @param parser the DSL parser
     * @return the factory
     */
    public static BiFunction<String, String, Document> parsing(DslParser parser) {
        Objects.requireNonNull(parser, "parser cannot be null");
        return (id, text) -> new Document(id, text, parser.parseForest(text));
    }

    /**
     * Builds one document per input, then applies the steps to it.
     *
     * @param inputs  inputs by document id, processed in the map's iteration order
     * @param factory builds the document of one input
     * @param <I>     the input type
     * @return the report
     */
    public <I> BatchReport process(Map<String, I> inputs, BiFunction<String, I, Document> factory) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
        Run run = new Run();
        for (Map.Entry<String, I> input : inputs.entrySet()) {
            run.attempt(input.getKey(), () -> {
                Document document = factory.apply(input.getKey(), input.getValue());
                applySteps(document);
                return document;
            });
        }
        return run.report();
    }

    /**
     * Applies the steps to already built documents.
     *
     * @param documents the documents, rewritten in place
     * @return the report
     */
    public BatchReport apply(Collection<Document> documents) {
        Objects.requireNonNull(documents, "documents cannot be null");
        Run run = new Run();
        for (Document document : documents) {
            run.attempt(document.id(), () -> {
                applySteps(document);
                return document;
            });
        }
        return run.report();
    }

    private void applySteps(Document document) {
        for (Consumer<Document> step : steps) {
            step.accept(document);
        }
    }

    @FunctionalInterface
    private interface DocumentWork {
        Document run();
    }

    /**
     * Accumulates the outcome of one run.
     */
    private static final class Run {
        private final List<Document> successes = new ArrayList<>();
        private final List<BatchReport.Failure> failures = new ArrayList<>();
        private final List<String> discardable = new ArrayList<>();

        void attempt(String documentId, DocumentWork work) {
            try {
                Document document = work.run();
                successes.add(document);
                if (document.isDiscardable()) {
                    discardable.add(document.id());
                }
            } catch (CuratorException e) {
                FailureKind kind = FailureKind.of(e);
                Level level = kind == FailureKind.TREE_INVARIANT ? Level.SEVERE : Level.WARNING;
                log.log(level, e, () -> String.format("Skipping document '%s' (%s): %s", documentId, kind, e.getMessage()));
                failures.add(new BatchReport.Failure(documentId, kind, e.getMessage()));
            }
        }

        BatchReport report() {
            BatchReport report = new BatchReport(successes, failures, discardable);
            log.fine(() -> String.format("Batch done: %d succeeded, %d failed, %d discardable",
                    successes.size(), failures.size(), discardable.size()));
            return report;
        }
    }

    /**
     * Builder for {@link BatchProcessor}. Steps run in registration order.
     */
    public static final class Builder {

        private final List<Consumer<Document>> steps = new ArrayList<>();

        private Builder() {
        }

        public Builder step(Consumer<Document> step) {
            steps.add(Objects.requireNonNull(step, "step cannot be null"));
            return this;
        }

        public BatchProcessor build() {
            return new BatchProcessor(steps);
        }
    }
}
