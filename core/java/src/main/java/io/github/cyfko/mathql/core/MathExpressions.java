package io.github.cyfko.mathql.core;

import io.github.cyfko.mathql.core.api.ExpressionEngine;
import io.github.cyfko.mathql.core.api.ExpressionPreview;
import io.github.cyfko.mathql.core.config.EnginePolicy;
import io.github.cyfko.mathql.core.impl.BasicExpressionEngine;

import java.util.Map;
import java.util.Objects;

/**
 * High-level facade over the math channel expression engine.
 * <p>
 * Most callers only need the two static shortcuts, which delegate to a shared engine built
 * with {@link EnginePolicy#defaults()}:
 * </p>
 *
 * <pre>{@code
 * Double value = MathExpressions.evaluate("sqrt(a^2 + b^2)", Map.of("a", 3, "b", 4)); // 5.0
 * ExpressionPreview preview = MathExpressions.render("a / b", Map.of("a", "#1f77b4"));
 *
 * // Dedicated engine with a different policy
 * ExpressionEngine engine = MathExpressions.engine(EnginePolicy.builder().equationLabel("").build());
 * }</pre>
 *
 * @see ExpressionEngine
 * @see BasicExpressionEngine
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MathExpressions {

    private static final ExpressionEngine DEFAULT_ENGINE = new BasicExpressionEngine();

    private MathExpressions() {}

    /**
     * @return the shared engine using the default policy
     */
    public static ExpressionEngine defaultEngine() {
        return DEFAULT_ENGINE;
    }

    /**
     * Creates an engine with the given policy.
     *
     * @param policy the policy to apply. Must not be null.
     * @return a new engine
     * @throws NullPointerException if policy is null
     */
    public static ExpressionEngine engine(EnginePolicy policy) {
        Objects.requireNonNull(policy, "Engine policy cannot be null");
        return new BasicExpressionEngine(policy);
    }

    /**
     * Shortcut for {@code defaultEngine().evaluate(expression, bindings)}.
     */
    public static Double evaluate(String expression, Map<String, ? extends Number> bindings) {
        return DEFAULT_ENGINE.evaluate(expression, bindings);
    }

    /**
     * Shortcut for {@code defaultEngine().render(expression, variableColors)}.
     */
    public static ExpressionPreview render(String expression, Map<String, String> variableColors) {
        return DEFAULT_ENGINE.render(expression, variableColors);
    }
}
