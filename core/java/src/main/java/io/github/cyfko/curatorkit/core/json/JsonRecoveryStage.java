package io.github.cyfko.curatorkit.core.json;

/**
 * One strategy of the {@link JsonRecoveryPipeline}: turns text into a JSON value or fails.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface JsonRecoveryStage {

    /**
     * @param text JSON-shaped text
     * @return the parsed value
     * @throws Exception any failure; the pipeline records its message and moves on
     */
    Object recover(String text) throws Exception;
}
