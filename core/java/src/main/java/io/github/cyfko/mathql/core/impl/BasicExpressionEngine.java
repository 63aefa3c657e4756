package io.github.cyfko.mathql.core.impl;

import io.github.cyfko.mathql.core.api.ExpressionEngine;
import io.github.cyfko.mathql.core.api.ExpressionPreview;
import io.github.cyfko.mathql.core.ast.ExpressionNode;
import io.github.cyfko.mathql.core.config.EnginePolicy;
import io.github.cyfko.mathql.core.eval.ExpressionEvaluator;
import io.github.cyfko.mathql.core.exception.EvaluationException;
import io.github.cyfko.mathql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.mathql.core.exception.IdentifierRejectedException;
import io.github.cyfko.mathql.core.parsing.ExpressionLexer;
import io.github.cyfko.mathql.core.parsing.ExpressionParser;
import io.github.cyfko.mathql.core.parsing.IdentifierGuard;
import io.github.cyfko.mathql.core.parsing.NamespaceResolver;
import io.github.cyfko.mathql.core.render.FallbackRenderer;
import io.github.cyfko.mathql.core.render.LatexRenderer;
import io.github.cyfko.mathql.core.utils.ValidationResult;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link ExpressionEngine}.
 *
 * <h2>Evaluation pipeline</h2>
 * <ol>
 *   <li><strong>Trim and bound</strong>: blank input, or input longer than
 *       {@link EnginePolicy#maxExpressionLength()}, yields {@code null}</li>
 *   <li><strong>Resolve</strong>: {@link NamespaceResolver#resolve(String)} attaches the
 *       {@code Math.} namespace and folds {@code **} into {@code ^}</li>
 *   <li><strong>Guard</strong>: {@link IdentifierGuard#checkIdentifiers(String, java.util.Set)}
 *       rejects any identifier that is neither bound nor allow-listed</li>
 *   <li><strong>Parse</strong>: {@link ExpressionLexer} then {@link ExpressionParser}, bounded by
 *       {@link EnginePolicy#maxNestingDepth()}</li>
 *   <li><strong>Evaluate</strong>: {@link ExpressionEvaluator}; a non-finite result yields {@code null}</li>
 * </ol>
 *
 * <h2>Rendering pipeline</h2>
 * <p>
 * The same resolve and parse steps feed {@link LatexRenderer}. When parsing or typesetting fails, the
 * trimmed text goes through {@link FallbackRenderer} instead, so a preview is produced for
 * any input that fits the policy. Successful previews are prefixed with the policy's
 * equation label ({@code y = ...}).
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * ExpressionEngine engine = new BasicExpressionEngine();
 * Double celsius = engine.evaluate("(a - 32) * 5 / 9", Map.of("a", 212)); // 100.0
 *
 * ExpressionEngine strict = new BasicExpressionEngine(EnginePolicy.strict());
 * }</pre>
 *
 * <p>Instances hold no mutable state and can be shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicExpressionEngine implements ExpressionEngine {

    private static final Logger logger = Logger.getLogger(BasicExpressionEngine.class.getName());

    private static final String EMPTY_PREVIEW = "\\texttt{ }";

    private final EnginePolicy enginePolicy;

    /**
     * Default constructor using {@link EnginePolicy#defaults()}.
     */
    public BasicExpressionEngine() {
        this(EnginePolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param enginePolicy the engine configuration
     * @throws IllegalArgumentException if enginePolicy is null
     */
    public BasicExpressionEngine(EnginePolicy enginePolicy) {
        if (enginePolicy == null) {
            throw new IllegalArgumentException("Engine policy is required");
        }
        this.enginePolicy = enginePolicy;
    }

    public EnginePolicy getEnginePolicy() {
        return enginePolicy;
    }

    @Override
    public Double evaluate(String expression, Map<String, ? extends Number> bindings) {
        if (expression == null) {
            return null;
        }
        String trimmed = expression.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (!enginePolicy.accepts(trimmed)) {
            logger.fine(() -> String.format(
                    "Expression of %d characters exceeds the limit of %d (%s)",
                    trimmed.length(), enginePolicy.maxExpressionLength(), enginePolicy.policyName()
            ));
            return null;
        }

        Map<String, ? extends Number> values = bindings == null ? Map.of() : bindings;
        try {
            String resolved = NamespaceResolver.resolve(trimmed);

            ValidationResult validation = IdentifierGuard.checkIdentifiers(resolved, values.keySet());
            if (!validation.isValid()) {
                throw new IdentifierRejectedException(validation.getRejectedIdentifier());
            }

            ExpressionNode root = ExpressionParser.parse(
                    ExpressionLexer.tokenize(resolved), enginePolicy.maxNestingDepth());
            double result = ExpressionEvaluator.evaluate(root, values);
            if (Double.isNaN(result) || Double.isInfinite(result)) {
                logger.fine(() -> "Expression '" + trimmed + "' produced a non-finite value: " + result);
                return null;
            }
            return result;
        } catch (ExpressionSyntaxException | IdentifierRejectedException | EvaluationException e) {
            logger.fine(() -> "Expression '" + trimmed + "' could not be evaluated: " + e.getMessage());
            return null;
        }
    }

    @Override
    public ExpressionPreview render(String expression, Map<String, String> variableColors) {
        String trimmed = expression == null ? "" : expression.trim();
        if (trimmed.isEmpty()) {
            return ExpressionPreview.empty();
        }
        if (!enginePolicy.accepts(trimmed)) {
            return ExpressionPreview.failure(String.format(
                    "Expression too long (%d characters, limit is %d)",
                    trimmed.length(), enginePolicy.maxExpressionLength()
            ));
        }

        try {
            String latex = LatexRenderer.render(parse(trimmed), variableColors);
            if (!latex.isEmpty()) {
                return ExpressionPreview.of(withLabel(latex));
            }
        } catch (RuntimeException e) {
            logger.fine(() -> "Falling back to plain preview for '" + trimmed + "': " + e);
        }

        try {
            String scanned = FallbackRenderer.render(trimmed, variableColors);
            return ExpressionPreview.of(scanned.isEmpty() ? EMPTY_PREVIEW : withLabel(scanned));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Unable to render formula preview for '" + trimmed + "'", e);
            return ExpressionPreview.failure(
                    e.getMessage() != null ? e.getMessage() : "Unable to render formula preview");
        }
    }

    /**
     * Parses the given expression into an {@link ExpressionNode} tree.
     * <p>
     * The expression is trimmed and namespace-resolved first, exactly as for evaluation and
     * rendering. Identifiers are not checked: the tree may reference unbound variables.
     * </p>
     *
     * @param expression the expression to parse
     * @return the parsed tree
     * @throws ExpressionSyntaxException if the expression is {@code null}, blank, too long, nested
     *                                   deeper than the policy allows, or malformed
     */
    @Override
    public ExpressionNode parse(String expression) throws ExpressionSyntaxException {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionSyntaxException("Expression cannot be null or empty");
        }
        String trimmed = expression.trim();
        if (!enginePolicy.accepts(trimmed)) {
            throw new ExpressionSyntaxException(String.format(
                    "Expression exceeds maximum length of %d characters (%s)",
                    enginePolicy.maxExpressionLength(), enginePolicy.policyName()
            ));
        }
        return ExpressionParser.parse(
                ExpressionLexer.tokenize(NamespaceResolver.resolve(trimmed)), enginePolicy.maxNestingDepth());
    }

    private String withLabel(String formula) {
        String label = enginePolicy.equationLabel();
        return label.isEmpty() ? formula : label + " = " + formula;
    }
}
