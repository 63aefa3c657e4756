package io.github.cyfko.mathql.core.config;

import io.github.cyfko.mathql.core.eval.MathConstant;
import io.github.cyfko.mathql.core.eval.MathFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MathAllowListTest {

    @Test
    @DisplayName("Table sizes")
    void sizes() {
        assertEquals(34, MathAllowList.FUNCTION_NAMES.size());
        assertEquals(8, MathAllowList.CONSTANT_NAMES.size());
        assertEquals(List.of("a", "b", "c", "d", "e", "f", "g", "h"), MathAllowList.VARIABLES);
        assertEquals(8, MathAllowList.VARIABLE_ALPHABET_SIZE);
        assertEquals(1 + 34 + 8, MathAllowList.ALLOWED_IDENTIFIERS.size());
    }

    @Test
    @DisplayName("Every allow-listed function has an implementation")
    void functionsImplemented() {
        for (String name : MathAllowList.FUNCTION_NAMES) {
            assertTrue(MathFunction.fromName(name).isPresent(), () -> "Missing implementation for " + name);
        }
        assertEquals(MathAllowList.FUNCTION_NAMES.size(), MathFunction.values().length);
    }

    @Test
    @DisplayName("Every allow-listed constant has a value")
    void constantsImplemented() {
        for (String name : MathAllowList.CONSTANT_NAMES) {
            assertTrue(MathConstant.fromName(name).isPresent(), () -> "Missing value for " + name);
        }
        assertEquals(MathAllowList.CONSTANT_NAMES.size(), MathConstant.values().length);
    }

    @Test
    @DisplayName("Lookups")
    void lookups() {
        assertTrue(MathAllowList.isFunction("hypot"));
        assertFalse(MathAllowList.isFunction("PI"));
        assertTrue(MathAllowList.isConstant("SQRT1_2"));
        assertFalse(MathAllowList.isConstant("pi"));
        assertTrue(MathAllowList.isAllowedIdentifier("Math"));
        assertFalse(MathAllowList.isAllowedIdentifier("a"));
        assertFalse(MathAllowList.isAllowedIdentifier(null));
    }

    @Test
    @DisplayName("Help labels")
    void labels() {
        assertTrue(MathAllowList.FUNCTION_LABEL.startsWith("abs, acos, acosh"));
        assertTrue(MathAllowList.FUNCTION_LABEL.endsWith("tanh, trunc"));
        assertEquals("E, LN2, LN10, LOG2E, LOG10E, PI, SQRT1_2, SQRT2", MathAllowList.CONSTANT_LABEL);
    }
}
