package io.github.cyfko.mathql.core.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FallbackRendererTest {

    @Test
    @DisplayName("Incomplete expression keeps its shape")
    void incompleteExpression() {
        String markup = FallbackRenderer.render("a +* b", Map.of("a", "#ff0000"));

        assertEquals("\\textcolor{#ff0000}{\\texttt{a}}\\texttt{ +}\\,\\cdot\\,\\texttt{ }\\texttt{b}", markup);
    }

    @Test
    @DisplayName("Double star stays literal")
    void doubleStar() {
        assertEquals("\\texttt{a}\\texttt{ ** }\\texttt{b}", FallbackRenderer.render("a ** b", null));
    }

    @Test
    @DisplayName("Unclosed call")
    void unclosedCall() {
        assertEquals("\\texttt{sin}\\texttt{(}\\texttt{a}", FallbackRenderer.render("sin(a", Map.of()));
    }

    @Test
    @DisplayName("Special characters are escaped")
    void escaping() {
        assertEquals("\\texttt{a\\_1}\\texttt{ \\#}", FallbackRenderer.render("a_1 #", Map.of()));
    }

    @Test
    @DisplayName("Lone star")
    void loneStar() {
        assertEquals("\\,\\cdot\\,", FallbackRenderer.render("*", Map.of()));
    }

    @Test
    @DisplayName("Empty input gives empty markup")
    void emptyInput() {
        assertEquals("", FallbackRenderer.render("", Map.of()));
    }
}
