package io.github.cyfko.mathql.core.parsing;

/**
 * Kinds of lexical tokens produced by {@link ExpressionLexer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    /** Numeric literal without sign or exponent, e.g. {@code 3.14}. */
    NUMBER,
    /** Identifier, dotted unknown member, or an unrecognised character. */
    VARIABLE,
    /** One of {@code + - * / ^}; {@code **} is emitted as {@code ^}. */
    OPERATOR,
    OPEN_PAREN,
    CLOSE_PAREN,
    COMMA,
    /** Allow-listed function reached through the namespace, text is the bare name. */
    FUNCTION,
    /** Allow-listed constant reached through the namespace, text is the bare name. */
    CONSTANT
}
