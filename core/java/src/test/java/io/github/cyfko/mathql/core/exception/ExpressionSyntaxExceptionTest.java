package io.github.cyfko.mathql.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionSyntaxExceptionTest {

    @Test
    @DisplayName("Should create ExpressionSyntaxException with message")
    void shouldCreateWithMessage() {
        // When
        ExpressionSyntaxException exception = new ExpressionSyntaxException("Expression is empty");

        // Then
        assertEquals("Expression is empty", exception.getMessage());
        assertEquals(-1, exception.getPosition());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should carry the token position")
    void shouldCarryPosition() {
        // When
        ExpressionSyntaxException exception = new ExpressionSyntaxException("Unexpected token 'b' at position 2", 2);

        // Then
        assertEquals(2, exception.getPosition());
    }

    @Test
    @DisplayName("Should create ExpressionSyntaxException with message and cause")
    void shouldCreateWithCause() {
        // Given
        Throwable cause = new IllegalArgumentException("Root cause");

        // When
        ExpressionSyntaxException exception = new ExpressionSyntaxException("Invalid expression", cause);

        // Then
        assertEquals("Invalid expression", exception.getMessage());
        assertSame(cause, exception.getCause());
        assertEquals(-1, exception.getPosition());
    }

    @Test
    @DisplayName("Should be unchecked")
    void shouldBeUnchecked() {
        assertInstanceOf(RuntimeException.class, new ExpressionSyntaxException("test"));
        assertInstanceOf(RuntimeException.class, new EvaluationException("test"));
        assertInstanceOf(RuntimeException.class, new IdentifierRejectedException("x"));
    }

    @Test
    @DisplayName("Identifier rejection names the identifier")
    void identifierRejected() {
        IdentifierRejectedException exception = new IdentifierRejectedException("window");

        assertEquals("window", exception.getIdentifier());
        assertEquals("Identifier 'window' is not allowed in math expressions", exception.getMessage());
    }
}
