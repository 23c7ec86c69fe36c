package io.github.cyfko.curatorkit.core.config;

/**
 * Selects which stages of the JSON recovery pipeline may run.
 * <p>
 * The strict parse always runs first. The remaining stages are tried in order, each only
 * when the previous one failed.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // All local stages, no external repair (default)
 * RecoveryPolicy policy = RecoveryPolicy.defaults();
 *
 * // Strict JSON only
 * RecoveryPolicy policy = RecoveryPolicy.strictOnly();
 *
 * // Everything, including the external repairer as last resort
 * RecoveryPolicy policy = RecoveryPolicy.withExternalRepair();
 * }</pre>
 *
 * @param regexRepairEnabled   run the textual repair pass before re-parsing strictly
 * @param tolerantParseEnabled run the fault-tolerant parser
 * @param externalRepairEnabled hand the text to the external repairer when all local stages failed
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RecoveryPolicy(
        boolean regexRepairEnabled,
        boolean tolerantParseEnabled,
        boolean externalRepairEnabled
) {

    /**
     * Default configuration: every local stage, no external repair.
     *
     * @return default configuration
     */
    public static RecoveryPolicy defaults() {
        return new RecoveryPolicy(
                true,   // regexRepairEnabled
                true,   // tolerantParseEnabled
                false   // externalRepairEnabled
        );
    }

    /**
     * Strict JSON parsing only; any malformation is a failure.
     *
     * @return strict configuration
     */
    public static RecoveryPolicy strictOnly() {
        return new RecoveryPolicy(false, false, false);
    }

    /**
     * Every local stage, then the external repairer.
     *
     * @return configuration enabling all stages
     */
    public static RecoveryPolicy withExternalRepair() {
        return new RecoveryPolicy(true, true, true);
    }
}
