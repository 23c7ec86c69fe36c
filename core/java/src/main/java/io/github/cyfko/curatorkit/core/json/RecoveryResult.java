package io.github.cyfko.curatorkit.core.json;

import java.util.List;

/**
 * Outcome of a {@link JsonRecoveryPipeline} run.
 * <p>
 * A successful result carries the parsed value, the name of the stage that produced it and
 * the repairs that stage reported. A failed result carries the error of every stage tried,
 * in order.
 * </p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * RecoveryResult result = pipeline.recover(modelOutput);
 * if (result.isSuccess()) {
 *     Object json = result.getValue();
 * } else {
 *     result.getStageErrors().forEach(System.out::println);
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RecoveryResult {

    private final boolean success;
    private final Object value;
    private final String stage;
    private final List<String> warnings;
    private final List<String> stageErrors;

    private RecoveryResult(boolean success, Object value, String stage, List<String> warnings, List<String> stageErrors) {
        this.success = success;
        this.value = value;
        this.stage = stage;
        this.warnings = List.copyOf(warnings);
        this.stageErrors = List.copyOf(stageErrors);
    }

    /**
     * @param value       the parsed value, possibly {@code null} for the JSON literal {@code null}
     * @param stage       name of the winning stage
     * @param warnings    repairs reported by the winning stage
     * @param stageErrors errors of the stages tried before it
     * @return a successful result
     */
    public static RecoveryResult success(Object value, String stage, List<String> warnings, List<String> stageErrors) {
        return new RecoveryResult(true, value, stage, warnings, stageErrors);
    }

    /**
     * @param stageErrors the error of every stage tried
     * @return a failed result
     */
    public static RecoveryResult failure(List<String> stageErrors) {
        return new RecoveryResult(false, null, null, List.of(), stageErrors);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return the parsed value; {@code null} for a failure
     */
    public Object getValue() {
        return value;
    }

    /**
     * @return the winning stage name; {@code null} for a failure
     */
    public String getStage() {
        return stage;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<String> getStageErrors() {
        return stageErrors;
    }

    @Override
    public String toString() {
        return success ? "RecoveryResult[success=true, stage=" + stage + "]"
                : "RecoveryResult[success=false, errors=" + stageErrors + "]";
    }
}
