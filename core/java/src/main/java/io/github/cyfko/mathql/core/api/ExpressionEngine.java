package io.github.cyfko.mathql.core.api;

import io.github.cyfko.mathql.core.ast.ExpressionNode;
import io.github.cyfko.mathql.core.exception.ExpressionSyntaxException;

import java.util.Map;

/**
 * Entry point of the math channel expression language.
 * <p>
 * A math channel derives a measurement trace from other channels through an arithmetic
 * expression over the variables {@code a} to {@code h}. The engine exposes the two call
 * shapes the rest of an application needs: numeric evaluation on every measurement tick,
 * and a typeset preview while the expression is edited.
 * </p>
 *
 * <h2>Language</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Precedence</th><th>Associativity</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Grouping, calls</td><td>( ) f(x, y)</td><td>Highest</td><td>N/A</td></tr>
 * <tr><td>Sign</td><td>+x -x</td><td>4</td><td>Right</td></tr>
 * <tr><td>Power</td><td>^ (or **)</td><td>3</td><td>Right</td></tr>
 * <tr><td>Product, quotient</td><td>* /</td><td>2</td><td>Left</td></tr>
 * <tr><td>Sum, difference</td><td>+ -</td><td>1</td><td>Left</td></tr>
 * </tbody>
 * </table>
 * <p>
 * Functions and constants come from a fixed allow-list and may be written with or without
 * the {@code Math.} namespace: {@code sin(a)}, {@code Math.sqrt(a^2 + b^2)}, {@code PI * a}.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * ExpressionEngine engine = new BasicExpressionEngine();
 *
 * engine.evaluate("(a + b) / 2", Map.of("a", 3, "b", 5));   // 4.0
 * engine.evaluate("a / b", Map.of("a", 1, "b", 0));         // null (not finite)
 * engine.evaluate("a + window", Map.of("a", 1));            // null (rejected identifier)
 *
 * ExpressionPreview preview = engine.render("a * 9 / 5 + 32", Map.of("a", "#ff0000"));
 * preview.markup(); // y = \frac{\textcolor{#ff0000}{\texttt{a}} \cdot \texttt{9}}{\texttt{5}} + \texttt{32}
 * }</pre>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>{@link #evaluate} and {@link #render} never throw</li>
 *   <li>results depend only on the arguments: no hidden state, no I/O</li>
 *   <li>implementations must be safe for concurrent use</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionEngine {

    /**
     * Evaluates {@code expression} with the given variable values.
     * <p>
     * Returns {@code null} when the expression is blank, does not parse, references an
     * identifier that is neither bound nor allow-listed, fails while evaluating, or produces
     * a non-finite value. Callers treat {@code null} as "no sample this tick".
     * </p>
     *
     * @param expression expression text
     * @param bindings   variable values by name
     * @return the finite result, or {@code null}
     */
    Double evaluate(String expression, Map<String, ? extends Number> bindings);

    /**
     * Renders {@code expression} as typeset markup for preview.
     * <p>
     * An expression that does not parse is still rendered through a best-effort fallback;
     * {@link ExpressionPreview#error()} is only set when nothing at all can be produced.
     * A blank expression yields {@link ExpressionPreview#empty()}.
     * </p>
     *
     * @param expression     expression text
     * @param variableColors display color by variable name, may be null
     * @return the preview, never null
     */
    ExpressionPreview render(String expression, Map<String, String> variableColors);

    /**
     * Parses {@code expression} into its expression tree.
     *
     * @param expression expression text
     * @return the tree shared by evaluation and rendering
     * @throws ExpressionSyntaxException if the expression is blank or malformed
     */
    ExpressionNode parse(String expression) throws ExpressionSyntaxException;
}
