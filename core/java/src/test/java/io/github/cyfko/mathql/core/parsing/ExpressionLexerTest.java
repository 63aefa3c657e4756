package io.github.cyfko.mathql.core.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExpressionLexer Tests")
class ExpressionLexerTest {

    private static String describe(List<Token> tokens) {
        return tokens.stream()
                .map(token -> token.type() + ":" + token.text())
                .collect(Collectors.joining(" "));
    }

    @Nested
    @DisplayName("Operators and punctuation")
    class Operators {

        @Test
        @DisplayName("Single character operators, parentheses and comma")
        void singleCharacterTokens() {
            List<Token> tokens = ExpressionLexer.tokenize("(a+b)-c*d/e^f,g");

            assertEquals("OPEN_PAREN:( VARIABLE:a OPERATOR:+ VARIABLE:b CLOSE_PAREN:) OPERATOR:- "
                    + "VARIABLE:c OPERATOR:* VARIABLE:d OPERATOR:/ VARIABLE:e OPERATOR:^ VARIABLE:f "
                    + "COMMA:, VARIABLE:g", describe(tokens));
        }

        @Test
        @DisplayName("Double star is read as the power operator")
        void doubleStarIsPower() {
            List<Token> tokens = ExpressionLexer.tokenize("a ** b");

            assertEquals("VARIABLE:a OPERATOR:^ VARIABLE:b", describe(tokens));
            assertEquals(2, tokens.get(1).position());
        }

        @Test
        @DisplayName("Triple star is a power followed by a product")
        void tripleStar() {
            assertEquals("VARIABLE:a OPERATOR:^ OPERATOR:* VARIABLE:b",
                    describe(ExpressionLexer.tokenize("a***b")));
        }
    }

    @Nested
    @DisplayName("Numbers")
    class Numbers {

        @ParameterizedTest
        @ValueSource(strings = {"0", "42", "3.14", ".5", "3.", "007"})
        @DisplayName("Accepted numeric literals")
        void acceptedLiterals(String literal) {
            List<Token> tokens = ExpressionLexer.tokenize(literal);

            assertEquals(1, tokens.size());
            assertTrue(tokens.get(0).is(TokenType.NUMBER));
            assertEquals(literal, tokens.get(0).text());
        }

        @Test
        @DisplayName("A second dot starts a new token")
        void secondDotStartsNewToken() {
            assertEquals("NUMBER:1.2 NUMBER:.3", describe(ExpressionLexer.tokenize("1.2.3")));
        }

        @Test
        @DisplayName("A lone dot is a fallback token")
        void loneDot() {
            assertEquals("VARIABLE:. VARIABLE:a", describe(ExpressionLexer.tokenize(". a")));
        }
    }

    @Nested
    @DisplayName("Namespace members")
    class NamespaceMembers {

        @Test
        @DisplayName("Allow-listed function becomes a FUNCTION token")
        void functionMember() {
            List<Token> tokens = ExpressionLexer.tokenize("Math.sqrt(a ** 2)");

            assertEquals("FUNCTION:sqrt OPEN_PAREN:( VARIABLE:a OPERATOR:^ NUMBER:2 CLOSE_PAREN:)",
                    describe(tokens));
            assertEquals(0, tokens.get(0).position());
            assertEquals(9, tokens.get(1).position());
            assertEquals(15, tokens.get(4).position());
        }

        @Test
        @DisplayName("Allow-listed constant becomes a CONSTANT token")
        void constantMember() {
            assertEquals("CONSTANT:PI OPERATOR:* VARIABLE:a", describe(ExpressionLexer.tokenize("Math.PI * a")));
        }

        @Test
        @DisplayName("Whitespace around the dot is tolerated")
        void whitespaceAroundDot() {
            assertEquals("FUNCTION:sin OPEN_PAREN:( NUMBER:0 CLOSE_PAREN:)",
                    describe(ExpressionLexer.tokenize("Math . sin(0)")));
        }

        @Test
        @DisplayName("Unknown member keeps the dotted text as a variable")
        void unknownMember() {
            assertEquals("VARIABLE:Math.random OPEN_PAREN:( CLOSE_PAREN:)",
                    describe(ExpressionLexer.tokenize("Math.random()")));
        }

        @Test
        @DisplayName("Namespace without member is a plain identifier")
        void namespaceAlone() {
            assertEquals("VARIABLE:Math", describe(ExpressionLexer.tokenize("Math")));
            assertEquals("VARIABLE:Math VARIABLE:. OPEN_PAREN:(", describe(ExpressionLexer.tokenize("Math.(")));
        }

        @Test
        @DisplayName("Longer identifiers starting with the namespace are not namespaced")
        void longerIdentifier() {
            assertEquals("VARIABLE:Mathematics", describe(ExpressionLexer.tokenize("Mathematics")));
        }
    }

    @Nested
    @DisplayName("Totality")
    class Totality {

        @Test
        @DisplayName("Null and blank input produce no tokens")
        void nullAndBlank() {
            assertTrue(ExpressionLexer.tokenize(null).isEmpty());
            assertTrue(ExpressionLexer.tokenize(" \t\r\n").isEmpty());
        }

        @Test
        @DisplayName("Unknown characters become one-character tokens")
        void unknownCharacters() {
            List<Token> tokens = ExpressionLexer.tokenize("a # b");

            assertEquals("VARIABLE:a VARIABLE:# VARIABLE:b", describe(tokens));
            assertEquals(2, tokens.get(1).position());
        }

        @ParameterizedTest
        @ValueSource(strings = {"@@", "a$b", "{}[]", "'x'", "1e5", "a;b", "ä + ö"})
        @DisplayName("Arbitrary input never throws")
        void neverThrows(String input) {
            assertDoesNotThrow(() -> ExpressionLexer.tokenize(input));
        }
    }
}
