package io.github.cyfko.mathql.core.exception;

/**
 * Exception raised while walking an expression tree: unbound variable, unknown function or
 * constant, or a function called with the wrong number of arguments.
 * <p>
 * Numeric domain problems (division by zero, {@code sqrt(-1)}) do not raise this exception;
 * they produce non-finite values that the engine discards.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
