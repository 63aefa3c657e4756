package io.github.cyfko.mathql.core.eval;

import io.github.cyfko.mathql.core.ast.BinaryOperator;
import io.github.cyfko.mathql.core.ast.ExpressionNode;
import io.github.cyfko.mathql.core.ast.ExpressionVisitor;
import io.github.cyfko.mathql.core.exception.EvaluationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tree-walking evaluator over {@link ExpressionNode} trees.
 * <p>
 * Only the supplied bindings and the allow-listed {@link MathFunction functions} and
 * {@link MathConstant constants} are reachable; nothing else can be named by an expression.
 * Arithmetic follows IEEE 754: domain errors and division by zero yield NaN or infinities
 * rather than exceptions, leaving the finiteness decision to the caller.
 * </p>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>unbound variable (including unresolved {@code Math.x} members)</li>
 *   <li>unknown function or constant</li>
 *   <li>function called with an unsupported number of arguments</li>
 *   <li>malformed numeric literal</li>
 * </ul>
 * <p>All of them raise {@link EvaluationException}.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Each call to {@link #evaluate(ExpressionNode, Map)} uses its own visitor; trees and tables are
 * read-only, so concurrent evaluation of the same tree is safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionEvaluator implements ExpressionVisitor<Double> {

    private final Map<String, ? extends Number> bindings;

    private ExpressionEvaluator(Map<String, ? extends Number> bindings) {
        this.bindings = bindings;
    }

    /**
     * Evaluates {@code root} against {@code bindings}.
     *
     * @param root     expression tree
     * @param bindings variable values by name
     * @return the raw numeric result, possibly NaN or infinite
     * @throws EvaluationException if the tree references something that cannot be resolved
     */
    public static double evaluate(ExpressionNode root, Map<String, ? extends Number> bindings) {
        Objects.requireNonNull(root, "root");
        return root.accept(new ExpressionEvaluator(bindings == null ? Map.of() : bindings));
    }

    @Override
    public Double visitNumber(ExpressionNode.NumberLiteral node) {
        try {
            return Double.parseDouble(node.text());
        } catch (NumberFormatException e) {
            throw new EvaluationException("Malformed number literal '" + node.text() + "'", e);
        }
    }

    @Override
    public Double visitVariable(ExpressionNode.Variable node) {
        Number value = bindings.get(node.name());
        if (value == null) {
            throw new EvaluationException("Unbound variable '" + node.name() + "'");
        }
        return value.doubleValue();
    }

    @Override
    public Double visitConstant(ExpressionNode.Constant node) {
        return MathConstant.fromName(node.name())
                .map(MathConstant::value)
                .orElseThrow(() -> new EvaluationException("Unknown constant '" + node.name() + "'"));
    }

    @Override
    public Double visitUnary(ExpressionNode.UnaryOp node) {
        return node.sign().apply(node.operand().accept(this));
    }

    /**
     * Left-associative chains such as {@code a + b + c + ...} are walked along their left spine
     * without recursion, so their length does not grow the call stack.
     */
    @Override
    public Double visitBinary(ExpressionNode.BinaryOp node) {
        Deque<ExpressionNode.BinaryOp> spine = new ArrayDeque<>();
        ExpressionNode current = node;
        do {
            ExpressionNode.BinaryOp binary = (ExpressionNode.BinaryOp) current;
            spine.push(binary);
            current = binary.left();
        } while (current instanceof ExpressionNode.BinaryOp);

        double result = current.accept(this);
        while (!spine.isEmpty()) {
            ExpressionNode.BinaryOp binary = spine.pop();
            result = apply(binary.operator(), result, binary.right().accept(this));
        }
        return result;
    }

    private static double apply(BinaryOperator operator, double left, double right) {
        return switch (operator) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> left / right;
            case POWER -> MathFunction.power(left, right);
        };
    }

    @Override
    public Double visitCall(ExpressionNode.Call node) {
        MathFunction function = MathFunction.fromName(node.functionName())
                .orElseThrow(() -> new EvaluationException("Unknown function '" + node.functionName() + "'"));

        List<ExpressionNode> args = node.args();
        if (!function.acceptsArity(args.size())) {
            throw new EvaluationException(String.format(
                    "Function %s expects %s argument(s), got %d",
                    function.functionName(), function.arityDescription(), args.size()
            ));
        }

        double[] values = new double[args.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = args.get(i).accept(this);
        }
        return function.apply(values);
    }
}
