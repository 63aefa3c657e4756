package io.github.cyfko.mathql.core.config;

/**
 * Configuration of an expression engine.
 *
 * <h2>Configurable settings</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of a trimmed expression (default: 5000).
 *       Longer expressions are neither evaluated nor rendered.</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum nesting of groups, calls, signs, exponents and
 *       divisors (default: 64). Deeper expressions do not evaluate and are previewed as plain text.</li>
 *   <li><strong>equationLabel</strong>: Left-hand side prepended to previews as {@code label = formula}
 *       (default: {@code "y"}). An empty label emits the bare formula.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * EnginePolicy policy = EnginePolicy.defaults();
 *
 * // Strict (short expressions only)
 * EnginePolicy policy = EnginePolicy.strict();
 *
 * // Relaxed (generated or scripted expressions)
 * EnginePolicy policy = EnginePolicy.relaxed();
 *
 * // Custom
 * EnginePolicy policy = EnginePolicy.builder()
 *     .maxExpressionLength(200)
 *     .maxNestingDepth(16)
 *     .equationLabel("")
 *     .build();
 * }</pre>
 *
 * @param policyName          name of the policy, used in diagnostics
 * @param maxExpressionLength maximum character length of a trimmed expression
 * @param maxNestingDepth     maximum nesting depth of a parsed expression
 * @param equationLabel       left-hand side of rendered previews, possibly empty
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EnginePolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth,
    String equationLabel
) {

    public static final String DEFAULT_EQUATION_LABEL = "y";

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any setting is invalid
     */
    public EnginePolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (equationLabel == null) {
            throw new IllegalArgumentException("equationLabel is required (use an empty label to disable it)");
        }
    }

    /**
     * Default configuration, suitable for interactive editing of math channels.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     *   <li>Equation Label: {@code y}</li>
     * </ul>
     *
     * @return default configuration
     */
    public static EnginePolicy defaults() {
        return new EnginePolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 64, DEFAULT_EQUATION_LABEL);
    }

    /**
     * Strict configuration for expressions coming from untrusted sources.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 32</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static EnginePolicy strict() {
        return new EnginePolicy(PolicyName.STRICT_POLICY.name(), 1000, 32, DEFAULT_EQUATION_LABEL);
    }

    /**
     * Relaxed configuration for generated expressions.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 128</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static EnginePolicy relaxed() {
        return new EnginePolicy(PolicyName.RELAXED_POLICY.name(), 10000, 128, DEFAULT_EQUATION_LABEL);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are default initialized exactly as if created with the default mode.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tells whether the trimmed expression fits this policy.
     *
     * @param trimmedExpression expression with surrounding whitespace removed
     * @return {@code true} if the expression may be processed
     */
    public boolean accepts(String trimmedExpression) {
        return trimmedExpression.length() <= maxExpressionLength;
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 64;
        private String _equationLabel = DEFAULT_EQUATION_LABEL;

        private Builder() {}

        public EnginePolicy build() {
            return new EnginePolicy(_policyName, _maxExpressionLength, _maxNestingDepth, _equationLabel);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder equationLabel(String equationLabel) { this._equationLabel = equationLabel; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
