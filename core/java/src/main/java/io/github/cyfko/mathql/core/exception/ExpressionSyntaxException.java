package io.github.cyfko.mathql.core.exception;

import io.github.cyfko.mathql.core.api.ExpressionEngine;
import io.github.cyfko.mathql.core.parsing.ExpressionParser;

/**
 * Exception thrown when a math expression cannot be turned into an expression tree.
 * <p>
 * The parser is the single point of syntax-error reporting: the lexer never fails, so every
 * malformed input ends up here.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Exhausted input:</strong> the expression ends where an operand is expected ({@code a +})</li>
 *   <li><strong>Unmatched parentheses:</strong> {@code (a + b} or {@code a + b)}</li>
 *   <li><strong>Function without call:</strong> {@code Math.sin a}</li>
 *   <li><strong>Trailing tokens:</strong> {@code a b}</li>
 * </ul>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * engine.parse("a +");
 * // → "Unexpected end of expression"
 *
 * engine.parse("(a + b");
 * // → "Missing closing parenthesis for group opened at position 0"
 *
 * engine.parse("a b");
 * // → "Unexpected token 'b' at position 2"
 * }</pre>
 *
 * <p>{@link ExpressionEngine#evaluate} and {@link ExpressionEngine#render} never let this
 * exception escape; it is only visible to callers of {@link ExpressionEngine#parse}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExpressionParser
 */
public class ExpressionSyntaxException extends RuntimeException {

    private final int position;

    /**
     * Constructor with an explanatory error message and no known position.
     *
     * @param message the message describing the cause of the exception
     */
    public ExpressionSyntaxException(String message) {
        this(message, -1);
    }

    /**
     * Constructor with an explanatory error message and the offending source position.
     *
     * @param message  the message describing the cause of the exception
     * @param position zero-based offset in the analysed expression, or {@code -1} if unknown
     */
    public ExpressionSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public ExpressionSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1;
    }

    /**
     * @return zero-based offset of the offending token, or {@code -1} when unknown
     */
    public int getPosition() {
        return position;
    }
}
