package io.github.cyfko.curatorkit.core.config;

import java.util.regex.Pattern;

/**
 * Limits and switches applied by every text parser.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxInputLength</strong>: Maximum character length of a parsed text (default: 200000)</li>
 *   <li><strong>maxDepth</strong>: Maximum nesting of composites, lists and objects (default: 256)</li>
 *   <li><strong>identifierPattern</strong>: Pattern every criterion, rule and field name must match</li>
 *   <li><strong>allowTrailingComma</strong>: Accept {@code [1, 2,]} and {@code and{a(), }} (default: true)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (LLM output, trailing commas tolerated)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (hand-authored text, no trailing commas, smaller limits)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (large batch exports)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxDepth(64)
 *     .build();
 * }</pre>
 *
 * @param policyName         name reported in limit errors
 * @param maxInputLength     maximum character length of the input
 * @param maxDepth           maximum nesting depth
 * @param identifierPattern  pattern identifiers must match
 * @param allowTrailingComma whether a comma may directly precede a closing delimiter
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxInputLength,
    int maxDepth,
    Pattern identifierPattern,
    boolean allowTrailingComma
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive, got: " + maxInputLength);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (identifierPattern == null) {
            throw new IllegalArgumentException("identifierPattern is required");
        }
    }

    /**
     * Default configuration, tuned for text produced by a language model.
     * <ul>
     *   <li>Max Input Length: 200000 characters</li>
     *   <li>Max Depth: 256</li>
     *   <li>Trailing Comma: accepted</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 200_000, 256, PatternConfig.IDENTIFIER_PATTERN, true);
    }

    /**
     * Strict configuration for hand-authored text.
     * <ul>
     *   <li>Max Input Length: 20000 characters</li>
     *   <li>Max Depth: 64</li>
     *   <li>Trailing Comma: rejected</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 20_000, 64, PatternConfig.IDENTIFIER_PATTERN, false);
    }

    /**
     * Relaxed configuration for large trusted batch exports.
     * <ul>
     *   <li>Max Input Length: 5000000 characters</li>
     *   <li>Max Depth: 1024</li>
     *   <li>Trailing Comma: accepted</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 5_000_000, 1024, PatternConfig.IDENTIFIER_PATTERN, true);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default preset.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxInputLength = 200_000;
        private int _maxDepth = 256;
        private Pattern _identifierPattern = PatternConfig.IDENTIFIER_PATTERN;
        private boolean _allowTrailingComma = true;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxInputLength, _maxDepth, _identifierPattern, _allowTrailingComma);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxInputLength(int maxInputLength) { this._maxInputLength = maxInputLength; return this; }
        public Builder maxDepth(int maxDepth) { this._maxDepth = maxDepth; return this; }
        public Builder identifierPattern(Pattern identifierPattern) { this._identifierPattern = identifierPattern; return this; }
        public Builder allowTrailingComma(boolean allow) { this._allowTrailingComma = allow; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
