package io.github.cyfko.mathql.core.parsing;

import java.util.Objects;

/**
 * Lexical token with its source offset.
 *
 * @param type     token kind
 * @param text     token text (canonical operator symbol for operators)
 * @param position zero-based offset of the first character in the lexed source
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(char symbol) {
        return type == TokenType.OPERATOR && text.length() == 1 && text.charAt(0) == symbol;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
