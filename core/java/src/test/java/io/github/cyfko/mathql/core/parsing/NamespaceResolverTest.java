package io.github.cyfko.mathql.core.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class NamespaceResolverTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "sin(a)              | Math.sin(a)",
            "sinh(a)             | Math.sinh(a)",
            "asin(a)             | Math.asin(a)",
            "log10(a)            | Math.log10(a)",
            "sin (a)             | Math.sin(a)",
            "PI * a              | Math.PI * a",
            "2*PI                | 2*Math.PI",
            "E                   | Math.E",
            "sin(cos(a))         | Math.sin(Math.cos(a))",
            "max(PI,E)           | Math.max(Math.PI,Math.E)",
            "Math.sin(a)         | Math.sin(a)",
            "Math.PI             | Math.PI",
            "Math . sin(a)       | Math . sin(a)",
            "Math .PI            | Math .PI"
    })
    @DisplayName("Attaches the namespace to bare functions and constants")
    void attachesNamespace(String input, String expected) {
        assertEquals(expected, NamespaceResolver.attachNamespace(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"resin(a)", "PIE", "e", "pi", "sin", "a.PI", "SQRT2x", "abs_1"})
    @DisplayName("Leaves embedded, lowercase and uncalled names untouched")
    void leavesOtherNamesUntouched(String input) {
        assertEquals(input, NamespaceResolver.attachNamespace(input));
    }

    @Test
    @DisplayName("Folds ** into ^")
    void canonicalizesPower() {
        assertEquals("a ^ b ^ 2", NamespaceResolver.canonicalizePower("a ** b ** 2"));
        assertEquals("a ^ b", NamespaceResolver.resolve("a ** b"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"sin(a) + PI", "Math.cos(b) * E", "max(a, b) ** 2", "a + b"})
    @DisplayName("Resolution is idempotent")
    void idempotent(String input) {
        String once = NamespaceResolver.resolve(input);
        assertEquals(once, NamespaceResolver.resolve(once));
    }
}
