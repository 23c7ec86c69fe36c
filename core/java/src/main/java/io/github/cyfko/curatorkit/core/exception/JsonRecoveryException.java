package io.github.cyfko.curatorkit.core.exception;

import java.util.List;

/**
 * Exception thrown when every stage of a JSON recovery pipeline failed on the same text.
 * <p>
 * Carries one message per attempted stage, in the order the stages ran.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JsonRecoveryException extends CuratorException {

    private final List<String> stageErrors;

    /**
     * @param message     summary of the failure
     * @param stageErrors one entry per attempted stage, formatted as {@code "stage: error"}
     */
    public JsonRecoveryException(String message, List<String> stageErrors) {
        super(message);
        this.stageErrors = List.copyOf(stageErrors);
    }

    /** @return the error reported by each attempted stage */
    public List<String> stageErrors() {
        return stageErrors;
    }
}
