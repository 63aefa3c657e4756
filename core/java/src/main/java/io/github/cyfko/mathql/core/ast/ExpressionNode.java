package io.github.cyfko.mathql.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Node of a parsed math expression.
 * <p>
 * Trees are built once by the parser and never mutated afterwards: every node owns its
 * children exclusively and all node types are immutable records, so a tree may be evaluated
 * or rendered any number of times, concurrently.
 * </p>
 *
 * <h2>Node kinds</h2>
 * <ul>
 *   <li>{@link NumberLiteral} - numeric literal, kept as written</li>
 *   <li>{@link Variable} - bound variable (or an unresolved identifier)</li>
 *   <li>{@link Constant} - allow-listed named constant, without namespace</li>
 *   <li>{@link UnaryOp} - prefix sign</li>
 *   <li>{@link BinaryOp} - arithmetic operator</li>
 *   <li>{@link Call} - allow-listed function call</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionNode {

    /** Binding strength of a prefix sign. */
    int UNARY_PRECEDENCE = 4;

    /** Binding strength of literals, names, calls and groups. */
    int ATOM_PRECEDENCE = 5;

    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * @return the binding strength of this node, used to decide on parenthesization
     */
    default int precedence() {
        return ATOM_PRECEDENCE;
    }

    record NumberLiteral(String text) implements ExpressionNode {
        public NumberLiteral {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record Variable(String name) implements ExpressionNode {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    record Constant(String name) implements ExpressionNode {
        public Constant {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    record UnaryOp(Sign sign, ExpressionNode operand) implements ExpressionNode {
        public UnaryOp {
            Objects.requireNonNull(sign, "sign");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public int precedence() {
            return UNARY_PRECEDENCE;
        }
    }

    record BinaryOp(BinaryOperator operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public int precedence() {
            return operator.precedence();
        }
    }

    record Call(String functionName, List<ExpressionNode> args) implements ExpressionNode {
        public Call {
            Objects.requireNonNull(functionName, "functionName");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }
}
