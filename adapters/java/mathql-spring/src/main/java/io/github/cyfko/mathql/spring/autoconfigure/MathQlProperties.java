package io.github.cyfko.mathql.spring.autoconfigure;

import io.github.cyfko.mathql.core.channel.MathChannelHistory;
import io.github.cyfko.mathql.core.config.EnginePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code mathql.*} namespace.
 *
 * <pre>
 * mathql.policy=STRICT
 * mathql.max-expression-length=200
 * mathql.max-nesting-depth=16
 * mathql.equation-label=f
 * mathql.history-limit=10000
 * </pre>
 */
@ConfigurationProperties(prefix = "mathql")
public class MathQlProperties {

    private Policy policy = Policy.DEFAULT;
    private Integer maxExpressionLength;
    private Integer maxNestingDepth;
    private String equationLabel;
    private int historyLimit = MathChannelHistory.DEFAULT_HISTORY_LIMIT;

    public enum Policy {
        DEFAULT,
        STRICT,
        RELAXED
    }

    /**
     * Builds the engine policy: the selected preset, with the optional overrides applied.
     */
    public EnginePolicy toEnginePolicy() {
        EnginePolicy preset = switch (policy) {
            case STRICT -> EnginePolicy.strict();
            case RELAXED -> EnginePolicy.relaxed();
            default -> EnginePolicy.defaults();
        };
        if (maxExpressionLength == null && maxNestingDepth == null && equationLabel == null) {
            return preset;
        }
        return new EnginePolicy(
                preset.policyName(),
                maxExpressionLength != null ? maxExpressionLength : preset.maxExpressionLength(),
                maxNestingDepth != null ? maxNestingDepth : preset.maxNestingDepth(),
                equationLabel != null ? equationLabel : preset.equationLabel()
        );
    }

    public Policy getPolicy() {
        return policy;
    }

    public void setPolicy(Policy policy) {
        this.policy = policy;
    }

    public Integer getMaxExpressionLength() {
        return maxExpressionLength;
    }

    public void setMaxExpressionLength(Integer maxExpressionLength) {
        this.maxExpressionLength = maxExpressionLength;
    }

    public Integer getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(Integer maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public String getEquationLabel() {
        return equationLabel;
    }

    public void setEquationLabel(String equationLabel) {
        this.equationLabel = equationLabel;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }
}
