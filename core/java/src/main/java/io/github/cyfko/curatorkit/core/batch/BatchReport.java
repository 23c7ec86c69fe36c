package io.github.cyfko.curatorkit.core.batch;

import io.github.cyfko.curatorkit.core.model.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a {@link BatchProcessor} run.
 *
 * @param successes   documents processed without error, in input order
 * @param failures    one entry per failed document, in input order
 * @param discardable ids of the successful documents left without any root
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BatchReport(List<Document> successes, List<Failure> failures, List<String> discardable) {

    public BatchReport {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
        discardable = List.copyOf(discardable);
    }

    /**
     * A document that could not be processed.
     *
     * @param documentId the document id
     * @param kind       the error category
     * @param message    the error message
     */
    public record Failure(String documentId, FailureKind kind, String message) {
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int processed() {
        return successes.size() + failures.size();
    }

    /**
     * @return the successful documents that still hold at least one root
     */
    public List<Document> retained() {
        List<Document> retained = new ArrayList<>();
        for (Document document : successes) {
            if (!document.isDiscardable()) {
                retained.add(document);
            }
        }
        return retained;
    }

    /**
     * @param kind an error category
     * @return the failures of that category
     */
    public List<Failure> failures(FailureKind kind) {
        List<Failure> matching = new ArrayList<>();
        for (Failure failure : failures) {
            if (failure.kind() == kind) {
                matching.add(failure);
            }
        }
        return matching;
    }
}
