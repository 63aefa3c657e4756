package io.github.cyfko.mathql.core.channel;

/**
 * One row of the variable legend shown next to an expression.
 *
 * @param variable variable name
 * @param alias    alias of the bound channel
 * @param color    color of the bound channel
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MathVariableLegendItem(String variable, String alias, String color) {
}
