package io.github.cyfko.mathql.core.parsing;

import io.github.cyfko.mathql.core.config.MathAllowList;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass tokenizer for math expressions.
 * <p>
 * The lexer is total: it never throws, whatever the input. Characters it does not recognise
 * are folded into one-character {@link TokenType#VARIABLE} tokens so that the parser remains
 * the single place where syntax errors are reported.
 * </p>
 *
 * <h2>Recognised tokens</h2>
 * <ul>
 *   <li>whitespace (space, tab, newline, carriage return) is skipped</li>
 *   <li>{@code **} is read as the power operator {@code ^}, before single-character operators</li>
 *   <li>{@code + - * / ^}, {@code (}, {@code )} and {@code ,}</li>
 *   <li>numbers: digits with at most one {@code .}; {@code .5} and {@code 3.} are numbers too</li>
 *   <li>identifiers: {@code [A-Za-z_][A-Za-z0-9_]*}</li>
 *   <li>{@code Math.<member>}: a {@link TokenType#FUNCTION} or {@link TokenType#CONSTANT} token carrying
 *       the bare member name when the member is allow-listed, otherwise a {@link TokenType#VARIABLE}
 *       token carrying the dotted text</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = ExpressionLexer.tokenize("Math.sqrt(a ** 2)");
 * // FUNCTION(sqrt) OPEN_PAREN VARIABLE(a) OPERATOR(^) NUMBER(2) CLOSE_PAREN
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionLexer {

    private ExpressionLexer() {}

    /**
     * Splits {@code source} into tokens.
     *
     * @param source raw expression, may be null
     * @return the token stream, empty for null or blank input
     */
    public static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        if (source == null) {
            return tokens;
        }

        final int length = source.length();
        int index = 0;

        while (index < length) {
            char c = source.charAt(index);

            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                index++;
                continue;
            }

            if (c == '*' && index + 1 < length && source.charAt(index + 1) == '*') {
                tokens.add(new Token(TokenType.OPERATOR, "^", index));
                index += 2;
                continue;
            }

            switch (c) {
                case '+', '-', '*', '/', '^' -> {
                    tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), index));
                    index++;
                    continue;
                }
                case '(' -> {
                    tokens.add(new Token(TokenType.OPEN_PAREN, "(", index));
                    index++;
                    continue;
                }
                case ')' -> {
                    tokens.add(new Token(TokenType.CLOSE_PAREN, ")", index));
                    index++;
                    continue;
                }
                case ',' -> {
                    tokens.add(new Token(TokenType.COMMA, ",", index));
                    index++;
                    continue;
                }
                default -> {
                    // other characters are handled below
                }
            }

            if (isDigit(c) || (c == '.' && index + 1 < length && isDigit(source.charAt(index + 1)))) {
                int end = index;
                boolean dotSeen = false;
                while (end < length) {
                    char current = source.charAt(end);
                    if (current == '.' && !dotSeen) {
                        dotSeen = true;
                    } else if (!isDigit(current)) {
                        break;
                    }
                    end++;
                }
                tokens.add(new Token(TokenType.NUMBER, source.substring(index, end), index));
                index = end;
                continue;
            }

            if (isIdentifierStart(c)) {
                int end = scanIdentifier(source, index);
                String word = source.substring(index, end);

                if (MathAllowList.NAMESPACE.equals(word)) {
                    int consumed = lexNamespacedMember(source, end, index, tokens);
                    if (consumed > 0) {
                        index = consumed;
                        continue;
                    }
                }

                tokens.add(new Token(TokenType.VARIABLE, word, index));
                index = end;
                continue;
            }

            // Fallback: any other character becomes a one-character token
            tokens.add(new Token(TokenType.VARIABLE, String.valueOf(c), index));
            index++;
        }

        return tokens;
    }

    /**
     * Reads {@code . member} after the namespace word.
     *
     * @return the index following the member, or {@code -1} when no member follows
     */
    private static int lexNamespacedMember(String source, int afterWord, int start, List<Token> tokens) {
        int lookahead = skipWhitespace(source, afterWord);
        if (lookahead >= source.length() || source.charAt(lookahead) != '.') {
            return -1;
        }
        lookahead = skipWhitespace(source, lookahead + 1);
        if (lookahead >= source.length() || !isIdentifierStart(source.charAt(lookahead))) {
            return -1;
        }

        int memberEnd = scanIdentifier(source, lookahead);
        String member = source.substring(lookahead, memberEnd);

        if (MathAllowList.isFunction(member)) {
            tokens.add(new Token(TokenType.FUNCTION, member, start));
        } else if (MathAllowList.isConstant(member)) {
            tokens.add(new Token(TokenType.CONSTANT, member, start));
        } else {
            tokens.add(new Token(TokenType.VARIABLE, MathAllowList.NAMESPACE + "." + member, start));
        }
        return memberEnd;
    }

    private static int scanIdentifier(String source, int start) {
        int end = start + 1;
        while (end < source.length() && isIdentifierPart(source.charAt(end))) {
            end++;
        }
        return end;
    }

    private static int skipWhitespace(String source, int from) {
        int index = from;
        while (index < source.length() && Character.isWhitespace(source.charAt(index))) {
            index++;
        }
        return index;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
