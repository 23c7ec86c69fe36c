package io.github.cyfko.curatorkit.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.curatorkit.core.api.LlmJsonRepairer;
import io.github.cyfko.curatorkit.core.config.ParserPolicy;
import io.github.cyfko.curatorkit.core.config.RecoveryPolicy;
import io.github.cyfko.curatorkit.core.exception.JsonRecoveryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Ordered fallback chain turning language-model output into a JSON value.
 * <p>
 * Stages are tried in order and the first success wins:
 * </p>
 * <ol>
 *   <li>{@value #STRICT}: strict parse with Jackson</li>
 *   <li>{@value #REGEX_REPAIR}: {@link RegexJsonRepair} then strict parse</li>
 *   <li>{@value #TOLERANT}: {@link SmartJsonParser}</li>
 *   <li>{@value #EXTERNAL_REPAIR}: the {@link LlmJsonRepairer} collaborator, then strict parse</li>
 * </ol>
 * <p>
 * Stages 2 to 4 are enabled through {@link RecoveryPolicy}. Every stage produces the same
 * value types: {@link java.util.LinkedHashMap}, {@link java.util.ArrayList}, {@link String},
 * {@link Long}, {@link Double}, {@link Boolean} and {@code null}.
 * </p>
 * <p>
 * {@link #recover(String)} never throws for bad input; it returns a {@link RecoveryResult}.
 * {@link #parseOrThrow(String)} is the throwing variant.
 * </p>
 *
 * <pre>{@code
 * JsonRecoveryPipeline pipeline = new JsonRecoveryPipeline(RecoveryPolicy.withExternalRepair(), myRepairer);
 * RecoveryResult result = pipeline.recover(modelOutput);
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JsonRecoveryPipeline {

    private static final Logger log = Logger.getLogger(JsonRecoveryPipeline.class.getName());

    public static final String STRICT = "strict";
    public static final String REGEX_REPAIR = "regex-repair";
    public static final String TOLERANT = "tolerant";
    public static final String EXTERNAL_REPAIR = "external-repair";

    private final ObjectMapper mapper;
    private final RecoveryPolicy recoveryPolicy;
    private final ParserPolicy parserPolicy;
    private final LlmJsonRepairer repairer;

    /**
     * Pipeline with {@link RecoveryPolicy#defaults()}: every local stage, no external repair.
     */
    public JsonRecoveryPipeline() {
        this(RecoveryPolicy.defaults(), ParserPolicy.defaults(), null);
    }

    public JsonRecoveryPipeline(RecoveryPolicy recoveryPolicy) {
        this(recoveryPolicy, ParserPolicy.defaults(), null);
    }

    public JsonRecoveryPipeline(RecoveryPolicy recoveryPolicy, LlmJsonRepairer repairer) {
        this(recoveryPolicy, ParserPolicy.defaults(), repairer);
    }

    /**
     * @param recoveryPolicy enabled stages
     * @param parserPolicy   limits of the tolerant parser
     * @param repairer       external collaborator, required when external repair is enabled
     * @throws IllegalArgumentException if external repair is enabled without a repairer
     */
    public JsonRecoveryPipeline(RecoveryPolicy recoveryPolicy, ParserPolicy parserPolicy, LlmJsonRepairer repairer) {
        this.recoveryPolicy = Objects.requireNonNull(recoveryPolicy, "Recovery policy is required");
        this.parserPolicy = Objects.requireNonNull(parserPolicy, "Parser policy is required");
        if (recoveryPolicy.externalRepairEnabled() && repairer == null) {
            throw new IllegalArgumentException("External repair is enabled but no LlmJsonRepairer was provided");
        }
        this.repairer = repairer;
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_LONG_FOR_INTS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Runs the enabled stages in order.
     *
     * @param text JSON-shaped text
     * @return the value of the first successful stage, or the error of every stage
     */
    public RecoveryResult recover(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Stage stage : stages(errors, warnings)) {
            try {
                Object value = stage.delegate().recover(text);
                if (!errors.isEmpty()) {
                    log.fine(() -> String.format("JSON recovered by stage '%s' after %d failed stage(s)", stage.name(), errors.size()));
                }
                return RecoveryResult.success(value, stage.name(), warnings, errors);
            } catch (Exception e) {
                warnings.clear();
                errors.add(stage.name() + ": " + e.getMessage());
                log.fine(() -> String.format("JSON recovery stage '%s' failed: %s", stage.name(), e.getMessage()));
            }
        }

        log.warning(() -> String.format("All %d JSON recovery stage(s) failed", errors.size()));
        return RecoveryResult.failure(errors);
    }

    /**
     * @param text JSON-shaped text
     * @return the recovered value
     * @throws JsonRecoveryException if every enabled stage failed
     */
    public Object parseOrThrow(String text) {
        RecoveryResult result = recover(text);
        if (!result.isSuccess()) {
            throw new JsonRecoveryException("Unable to recover JSON from model output", result.getStageErrors());
        }
        return result.getValue();
    }

    private List<Stage> stages(List<String> errors, List<String> warnings) {
        List<Stage> stages = new ArrayList<>();
        stages.add(new Stage(STRICT, this::parseStrict));
        if (recoveryPolicy.regexRepairEnabled()) {
            stages.add(new Stage(REGEX_REPAIR, text -> {
                String repaired = RegexJsonRepair.repair(text);
                Object value = parseStrict(repaired);
                if (!repaired.equals(text)) {
                    warnings.add("Textual repairs applied before strict parsing");
                }
                return value;
            }));
        }
        if (recoveryPolicy.tolerantParseEnabled()) {
            stages.add(new Stage(TOLERANT, text -> {
                SmartJsonParser parser = new SmartJsonParser(text, parserPolicy);
                Object value = parser.parse();
                warnings.addAll(parser.warnings());
                return value;
            }));
        }
        if (recoveryPolicy.externalRepairEnabled()) {
            stages.add(new Stage(EXTERNAL_REPAIR, text -> {
                String repaired = repairer.repair(text, String.join(System.lineSeparator(), errors));
                if (repaired == null) {
                    throw new IllegalStateException("External repairer returned no text");
                }
                warnings.add("Text repaired by the external repairer");
                return parseStrict(repaired);
            }));
        }
        return stages;
    }

    private Object parseStrict(String text) throws JsonProcessingException {
        return mapper.readValue(text, Object.class);
    }

    private record Stage(String name, JsonRecoveryStage delegate) {
    }
}
