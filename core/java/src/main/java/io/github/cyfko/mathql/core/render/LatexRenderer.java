package io.github.cyfko.mathql.core.render;

import io.github.cyfko.mathql.core.ast.BinaryOperator;
import io.github.cyfko.mathql.core.ast.ExpressionNode;
import io.github.cyfko.mathql.core.ast.ExpressionVisitor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders {@link ExpressionNode} trees as LaTeX for the expression preview.
 *
 * <h2>Output conventions</h2>
 * <ul>
 *   <li>numbers: monospace literals</li>
 *   <li>variables: monospace, tinted with the caller's legend color when present</li>
 *   <li>constants: conventional symbol ({@code PI} as {@code \pi}, {@code E} as an upright e, ...),
 *       unknown names as upright roman text</li>
 *   <li>{@code *}: {@code \cdot}; {@code /}: built-up fraction; {@code ^}: superscript</li>
 *   <li>{@code sqrt}/{@code cbrt}: radicals; {@code abs}: vertical bars; {@code floor}/{@code ceil}:
 *       floor and ceiling brackets; {@code pow(x, y)}: superscript; logarithms: {@code \ln},
 *       {@code \log_{10}}, {@code \log_{2}}; every other function: operator name with
 *       parenthesized arguments</li>
 * </ul>
 *
 * <h2>Parenthesization</h2>
 * <p>
 * A child is wrapped in {@code \left( \right)} when its precedence is lower than the one its
 * slot demands, with three refinements: both operands of {@code ^} are wrapped whenever they
 * are unary or binary nodes, the right operand of {@code -} and any operand of {@code *} are
 * wrapped when additive, and the operands of {@code /} are never wrapped.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LatexRenderer implements ExpressionVisitor<String> {

    private static final String ARGUMENT_SEPARATOR = ",\\,";

    private static final Map<String, String> CONSTANT_LATEX = Map.of(
            "PI", "\\pi",
            "E", "\\mathrm{e}",
            "LN2", "\\ln 2",
            "LN10", "\\ln 10",
            "LOG2E", "\\log_{2}\\mathrm{e}",
            "LOG10E", "\\log_{10}\\mathrm{e}",
            "SQRT2", "\\sqrt{2}",
            "SQRT1_2", "\\frac{1}{\\sqrt{2}}"
    );

    private static final Map<String, String> FUNCTION_LATEX = Map.ofEntries(
            Map.entry("sin", "\\sin"),
            Map.entry("cos", "\\cos"),
            Map.entry("tan", "\\tan"),
            Map.entry("asin", "\\arcsin"),
            Map.entry("acos", "\\arccos"),
            Map.entry("atan", "\\arctan"),
            Map.entry("sinh", "\\sinh"),
            Map.entry("cosh", "\\cosh"),
            Map.entry("tanh", "\\tanh"),
            Map.entry("asinh", "\\operatorname{arsinh}"),
            Map.entry("acosh", "\\operatorname{arcosh}"),
            Map.entry("atanh", "\\operatorname{artanh}"),
            Map.entry("exp", "\\exp"),
            Map.entry("log1p", "\\operatorname{log1p}"),
            Map.entry("round", "\\operatorname{round}"),
            Map.entry("trunc", "\\operatorname{trunc}"),
            Map.entry("sign", "\\operatorname{sign}"),
            Map.entry("hypot", "\\operatorname{hypot}"),
            Map.entry("max", "\\max"),
            Map.entry("min", "\\min"),
            Map.entry("fround", "\\operatorname{fround}"),
            Map.entry("imul", "\\operatorname{imul}"),
            Map.entry("clz32", "\\operatorname{clz32}"),
            Map.entry("atan2", "\\operatorname{atan2}"),
            Map.entry("pow", "\\operatorname{pow}"),
            Map.entry("expm1", "\\operatorname{expm1}")
    );

    private final Map<String, String> variableColors;

    private LatexRenderer(Map<String, String> variableColors) {
        this.variableColors = variableColors;
    }

    /**
     * Renders {@code root}.
     *
     * @param root           expression tree
     * @param variableColors display color by variable name, may be null
     * @return the LaTeX markup
     */
    public static String render(ExpressionNode root, Map<String, String> variableColors) {
        Objects.requireNonNull(root, "root");
        LatexRenderer renderer = new LatexRenderer(variableColors == null ? Map.of() : variableColors);
        return renderer.child(root, Slot.ROOT);
    }

    @Override
    public String visitNumber(ExpressionNode.NumberLiteral node) {
        return LatexText.monospace(node.text());
    }

    @Override
    public String visitVariable(ExpressionNode.Variable node) {
        String base = "\\texttt{" + LatexText.escapeIdentifier(node.name()) + "}";
        return LatexText.colored(variableColors.get(node.name()), base);
    }

    @Override
    public String visitConstant(ExpressionNode.Constant node) {
        String mapped = CONSTANT_LATEX.get(node.name());
        return mapped != null ? mapped : "\\mathrm{" + LatexText.escapeIdentifier(node.name()) + "}";
    }

    @Override
    public String visitUnary(ExpressionNode.UnaryOp node) {
        Slot operandSlot = new Slot(ExpressionNode.UNARY_PRECEDENCE, node.sign().symbol(), Position.RIGHT);
        return node.sign().symbol() + child(node.operand(), operandSlot);
    }

    @Override
    public String visitBinary(ExpressionNode.BinaryOp node) {
        BinaryOperator operator = node.operator();
        switch (operator) {
            case DIVIDE:
                return "\\frac{" + child(node.left(), Slot.ROOT) + "}{" + child(node.right(), Slot.ROOT) + "}";
            case POWER:
                return superscript(node.left(), node.right());
            default:
                return inlineChain(node);
        }
    }

    /**
     * Renders a run of {@code +}, {@code -} and {@code *} links along the left spine iteratively,
     * so long flat chains do not grow the call stack.
     */
    private String inlineChain(ExpressionNode.BinaryOp node) {
        Deque<ExpressionNode.BinaryOp> spine = new ArrayDeque<>();
        spine.push(node);
        ExpressionNode.BinaryOp link = node;
        while (link.left() instanceof ExpressionNode.BinaryOp left
                && isInline(left.operator())
                && !needsParentheses(left, slot(link.operator(), Position.LEFT))) {
            spine.push(left);
            link = left;
        }

        StringBuilder latex = new StringBuilder(child(link.left(), slot(link.operator(), Position.LEFT)));
        while (!spine.isEmpty()) {
            ExpressionNode.BinaryOp binary = spine.pop();
            BinaryOperator operator = binary.operator();
            String symbol = operator == BinaryOperator.MULTIPLY ? "\\cdot" : String.valueOf(operator.symbol());
            latex.append(' ').append(symbol).append(' ')
                    .append(child(binary.right(), slot(operator, Position.RIGHT)));
        }
        return latex.toString();
    }

    private static boolean isInline(BinaryOperator operator) {
        return operator != BinaryOperator.DIVIDE && operator != BinaryOperator.POWER;
    }

    private static Slot slot(BinaryOperator operator, Position position) {
        return new Slot(operator.precedence(), operator.symbol(), position);
    }

    @Override
    public String visitCall(ExpressionNode.Call node) {
        String name = node.functionName();
        List<ExpressionNode> args = node.args();

        switch (name) {
            case "sqrt":
                return "\\sqrt{" + firstArgument(args) + "}";
            case "cbrt":
                return "\\sqrt[3]{" + firstArgument(args) + "}";
            case "abs":
                return "\\left|" + firstArgument(args) + "\\right|";
            case "log":
                return "\\ln\\left(" + firstArgument(args) + "\\right)";
            case "log10":
                return "\\log_{10}\\left(" + firstArgument(args) + "\\right)";
            case "log2":
                return "\\log_{2}\\left(" + firstArgument(args) + "\\right)";
            case "floor":
                return "\\lfloor" + firstArgument(args) + "\\rfloor";
            case "ceil":
                return "\\lceil" + firstArgument(args) + "\\rceil";
            case "pow":
                if (args.size() == 2) {
                    return superscript(args.get(0), args.get(1));
                }
                break;
            default:
                break;
        }

        String arguments = args.stream()
                .map(arg -> child(arg, Slot.ROOT))
                .collect(Collectors.joining(ARGUMENT_SEPARATOR));
        String operatorName = FUNCTION_LATEX.getOrDefault(
                name, "\\operatorname{" + LatexText.escapeIdentifier(name) + "}");
        return operatorName + "\\left(" + arguments + "\\right)";
    }

    private String superscript(ExpressionNode base, ExpressionNode exponent) {
        int precedence = BinaryOperator.POWER.precedence();
        char symbol = BinaryOperator.POWER.symbol();
        return child(base, new Slot(precedence, symbol, Position.LEFT))
                + "^{" + child(exponent, new Slot(precedence, symbol, Position.RIGHT)) + "}";
    }

    private String firstArgument(List<ExpressionNode> args) {
        return args.isEmpty() ? "" : child(args.get(0), Slot.ROOT);
    }

    private String child(ExpressionNode node, Slot slot) {
        String latex = node.accept(this);
        return needsParentheses(node, slot) ? "\\left(" + latex + "\\right)" : latex;
    }

    static boolean needsParentheses(ExpressionNode child, Slot slot) {
        if (slot.isRoot() || slot.operator() == BinaryOperator.DIVIDE.symbol()) {
            return false;
        }
        boolean compound = child instanceof ExpressionNode.BinaryOp || child instanceof ExpressionNode.UnaryOp;
        if (slot.operator() == BinaryOperator.POWER.symbol()) {
            return compound;
        }
        if (child.precedence() < slot.precedence()) {
            return true;
        }
        boolean additive = child instanceof ExpressionNode.BinaryOp binary && binary.operator().isAdditive();
        if (slot.operator() == BinaryOperator.SUBTRACT.symbol() && slot.position() == Position.RIGHT && additive) {
            return true;
        }
        return slot.operator() == BinaryOperator.MULTIPLY.symbol() && additive;
    }

    enum Position { NONE, LEFT, RIGHT }

    /**
     * Position of a child inside its parent: the parent's precedence and operator symbol.
     */
    record Slot(int precedence, char operator, Position position) {
        static final Slot ROOT = new Slot(0, '\0', Position.NONE);

        boolean isRoot() {
            return operator == '\0';
        }
    }
}
