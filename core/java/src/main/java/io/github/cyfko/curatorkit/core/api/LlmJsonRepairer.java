package io.github.cyfko.curatorkit.core.api;

/**
 * External collaborator asked to repair JSON text once every local recovery stage failed.
 * <p>
 * Implementations typically send the text back to the language model that produced it,
 * together with the parse errors, and return the model's corrected answer. CuratorKit ships
 * no implementation: network calls and prompts belong to the caller.
 * </p>
 *
 * <p>The returned text is parsed strictly; it gets no further recovery.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.curatorkit.core.json.JsonRecoveryPipeline
 */
@FunctionalInterface
public interface LlmJsonRepairer {

    /**
     * @param malformedText the original text
     * @param errorSummary  the error of every local stage, one per line
     * @return the repaired text
     */
    String repair(String malformedText, String errorSummary);
}
