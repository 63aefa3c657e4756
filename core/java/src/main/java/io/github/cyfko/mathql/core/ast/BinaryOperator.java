package io.github.cyfko.mathql.core.ast;

/**
 * Binary arithmetic operators with their binding strength.
 * <p>
 * Higher precedence binds tighter. Power is the only right-associative operator.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum BinaryOperator {

    /** Addition: "+" */
    ADD('+', 1),

    /** Subtraction: "-" */
    SUBTRACT('-', 1),

    /** Multiplication: "*" */
    MULTIPLY('*', 2),

    /** Division: "/" */
    DIVIDE('/', 2),

    /** Exponentiation: "^" (also written "**") */
    POWER('^', 3);

    private final char symbol;
    private final int precedence;

    BinaryOperator(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public char symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isAdditive() {
        return this == ADD || this == SUBTRACT;
    }

    /**
     * Finds the operator written with {@code symbol}.
     *
     * @param symbol one of {@code + - * / ^}
     * @return the matching operator
     * @throws IllegalArgumentException if the symbol is not a binary operator
     */
    public static BinaryOperator fromSymbol(char symbol) {
        for (BinaryOperator operator : values()) {
            if (operator.symbol == symbol) return operator;
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }
}
