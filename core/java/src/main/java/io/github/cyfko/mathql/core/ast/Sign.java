package io.github.cyfko.mathql.core.ast;

/**
 * Prefix sign of a unary expression.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Sign {
    PLUS('+'),
    MINUS('-');

    private final char symbol;

    Sign(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public double apply(double value) {
        return this == MINUS ? -value : value;
    }

    public static Sign fromSymbol(char symbol) {
        return switch (symbol) {
            case '+' -> PLUS;
            case '-' -> MINUS;
            default -> throw new IllegalArgumentException("Unknown sign: " + symbol);
        };
    }
}
