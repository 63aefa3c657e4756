package io.github.cyfko.mathql.core.parsing;

import io.github.cyfko.mathql.core.ast.BinaryOperator;
import io.github.cyfko.mathql.core.ast.ExpressionNode;
import io.github.cyfko.mathql.core.ast.Sign;
import io.github.cyfko.mathql.core.exception.ExpressionSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser building an {@link ExpressionNode} tree from a token stream.
 *
 * <h2>Grammar (EBNF, lowest precedence first)</h2>
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := power (('*' | '/') power)*
 * power      := unary ('^' power)?
 * unary      := ('+' | '-') unary | primary
 * primary    := NUMBER | VARIABLE | CONSTANT
 *             | FUNCTION '(' (expression (',' expression)*)? ')'
 *             | '(' expression ')'
 * </pre>
 *
 * <ul>
 *   <li>{@code +}, {@code -}, {@code *} and {@code /} are left-associative</li>
 *   <li>{@code ^} is right-associative: {@code 2^3^2} is {@code 2^(3^2)}</li>
 *   <li>a sign binds tighter than {@code ^}: {@code -2^2} is {@code (-2)^2}</li>
 *   <li>function arity is not checked here; that is an evaluation concern</li>
 * </ul>
 *
 * <h2>Nesting limit</h2>
 * <p>
 * Groups, function calls, signs, exponents and divisor chains each open one nesting level.
 * Input nesting deeper than the limit is rejected with an {@link ExpressionSyntaxException},
 * so the trees handed to the evaluator and the renderer have a bounded height. Flat chains of
 * {@code +}, {@code -} and {@code *} are not nesting.
 * </p>
 *
 * <p>Instances are single use and not thread-safe; {@link #parse(List)} creates one per call.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionParser {

    /** Nesting limit applied by {@link #parse(List)}. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int index;
    private int depth;

    private ExpressionParser(List<Token> tokens, int maxNestingDepth) {
        this.tokens = tokens;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses a complete token stream.
     *
     * @param tokens tokens produced by {@link ExpressionLexer#tokenize(String)}
     * @return the root of the expression tree
     * @throws ExpressionSyntaxException if the stream is empty, ends early, misses a required
     *                                   parenthesis, or has tokens left after a complete expression
     */
    public static ExpressionNode parse(List<Token> tokens) {
        return parse(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Parses a complete token stream with an explicit nesting limit.
     *
     * @param tokens          tokens produced by {@link ExpressionLexer#tokenize(String)}
     * @param maxNestingDepth maximum number of nested groups, calls, signs, exponents and divisors
     * @return the root of the expression tree
     * @throws ExpressionSyntaxException if the stream is malformed or nests deeper than {@code maxNestingDepth}
     * @throws IllegalArgumentException  if {@code maxNestingDepth} is not positive
     */
    public static ExpressionNode parse(List<Token> tokens, int maxNestingDepth) {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (tokens == null || tokens.isEmpty()) {
            throw new ExpressionSyntaxException("Expression is empty", 0);
        }
        ExpressionParser parser = new ExpressionParser(tokens, maxNestingDepth);
        ExpressionNode root = parser.parseExpression();
        parser.ensureEnd();
        return root;
    }

    private void ensureEnd() {
        Token leftover = peek();
        if (leftover != null) {
            throw new ExpressionSyntaxException(String.format(
                    "Unexpected token '%s' at position %d", leftover.text(), leftover.position()
            ), leftover.position());
        }
    }

    private Token peek() {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    private Token consume() {
        Token token = peek();
        if (token != null) {
            index++;
        }
        return token;
    }

    private void enter(Token token) {
        if (++depth > maxNestingDepth) {
            throw new ExpressionSyntaxException(String.format(
                    "Expression nests deeper than %d levels at position %d", maxNestingDepth, token.position()
            ), token.position());
        }
    }

    private void leave() {
        depth--;
    }

    private int endPosition() {
        Token last = tokens.get(tokens.size() - 1);
        return last.position() + last.text().length();
    }

    private ExpressionNode parseExpression() {
        ExpressionNode node = parseTerm();
        while (true) {
            Token token = peek();
            if (token == null || !(token.isOperator('+') || token.isOperator('-'))) {
                return node;
            }
            consume();
            ExpressionNode right = parseTerm();
            node = new ExpressionNode.BinaryOp(BinaryOperator.fromSymbol(token.text().charAt(0)), node, right);
        }
    }

    private ExpressionNode parseTerm() {
        ExpressionNode node = parsePower();
        int divisions = 0;
        while (true) {
            Token token = peek();
            if (token == null || !(token.isOperator('*') || token.isOperator('/'))) {
                depth -= divisions;
                return node;
            }
            consume();
            // each divisor stacks another fraction on top of the previous ones
            if (token.isOperator('/')) {
                enter(token);
                divisions++;
            }
            ExpressionNode right = parsePower();
            node = new ExpressionNode.BinaryOp(BinaryOperator.fromSymbol(token.text().charAt(0)), node, right);
        }
    }

    private ExpressionNode parsePower() {
        ExpressionNode base = parseUnary();
        Token token = peek();
        if (token != null && token.isOperator('^')) {
            consume();
            enter(token);
            ExpressionNode exponent = parsePower();
            leave();
            return new ExpressionNode.BinaryOp(BinaryOperator.POWER, base, exponent);
        }
        return base;
    }

    private ExpressionNode parseUnary() {
        Token token = peek();
        if (token != null && (token.isOperator('+') || token.isOperator('-'))) {
            consume();
            enter(token);
            ExpressionNode operand = parseUnary();
            leave();
            return new ExpressionNode.UnaryOp(Sign.fromSymbol(token.text().charAt(0)), operand);
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        Token token = consume();
        if (token == null) {
            throw new ExpressionSyntaxException("Unexpected end of expression", endPosition());
        }

        return switch (token.type()) {
            case NUMBER -> new ExpressionNode.NumberLiteral(token.text());
            case VARIABLE -> new ExpressionNode.Variable(token.text());
            case CONSTANT -> new ExpressionNode.Constant(token.text());
            case FUNCTION -> parseCall(token);
            case OPEN_PAREN -> parseGroup(token);
            default -> throw new ExpressionSyntaxException(String.format(
                    "Unexpected token '%s' at position %d", token.text(), token.position()
            ), token.position());
        };
    }

    private ExpressionNode parseCall(Token function) {
        enter(function);
        Token open = consume();
        if (open == null || !open.is(TokenType.OPEN_PAREN)) {
            throw new ExpressionSyntaxException(String.format(
                    "Function %s must be followed by ()", function.text()
            ), open == null ? endPosition() : open.position());
        }

        List<ExpressionNode> args = new ArrayList<>();
        Token next = peek();
        if (next == null || !next.is(TokenType.CLOSE_PAREN)) {
            while (true) {
                args.add(parseExpression());
                Token delimiter = peek();
                if (delimiter != null && delimiter.is(TokenType.COMMA)) {
                    consume();
                    continue;
                }
                break;
            }
        }

        Token closing = consume();
        if (closing == null || !closing.is(TokenType.CLOSE_PAREN)) {
            throw new ExpressionSyntaxException(String.format(
                    "Function %s is missing closing parenthesis", function.text()
            ), closing == null ? endPosition() : closing.position());
        }
        leave();
        return new ExpressionNode.Call(function.text(), args);
    }

    private ExpressionNode parseGroup(Token open) {
        enter(open);
        ExpressionNode inner = parseExpression();
        Token closing = consume();
        if (closing == null || !closing.is(TokenType.CLOSE_PAREN)) {
            throw new ExpressionSyntaxException(String.format(
                    "Missing closing parenthesis for group opened at position %d", open.position()
            ), closing == null ? endPosition() : closing.position());
        }
        leave();
        return inner;
    }
}
