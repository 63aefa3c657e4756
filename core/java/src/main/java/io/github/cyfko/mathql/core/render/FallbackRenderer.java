package io.github.cyfko.mathql.core.render;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort preview for expressions that do not parse.
 * <p>
 * While an expression is being typed it is usually incomplete ({@code a +}, {@code sin(}),
 * yet the preview should still resemble it. This renderer scans the raw text without any
 * grammar: identifiers present in the legend are tinted, every other run of characters is
 * shown in monospace, and a single {@code *} is shown as a centered dot ({@code **} stays
 * literal).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FallbackRenderer {

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_]\\w*");
    private static final String CENTERED_DOT = "\\,\\cdot\\,";

    private FallbackRenderer() {}

    /**
     * Renders {@code expression} as monospace text with colored variables.
     *
     * @param expression     raw expression
     * @param variableColors display color by variable name, may be null
     * @return the markup, empty only for empty input
     */
    public static String render(String expression, Map<String, String> variableColors) {
        Map<String, String> colors = variableColors == null ? Map.of() : variableColors;
        StringBuilder result = new StringBuilder();
        int lastIndex = 0;

        Matcher matcher = IDENTIFIER_PATTERN.matcher(expression);
        while (matcher.find()) {
            if (matcher.start() > lastIndex) {
                result.append(formatSegment(expression.substring(lastIndex, matcher.start())));
            }

            String identifier = matcher.group();
            String color = colors.get(identifier);
            if (color != null && !color.isBlank()) {
                result.append(LatexText.colored(color, "\\texttt{" + LatexText.escapeText(identifier) + "}"));
            } else {
                result.append(LatexText.monospace(identifier));
            }
            lastIndex = matcher.end();
        }

        if (lastIndex < expression.length()) {
            result.append(formatSegment(expression.substring(lastIndex)));
        }
        return result.toString();
    }

    private static String formatSegment(String segment) {
        StringBuilder output = new StringBuilder();
        StringBuilder buffer = new StringBuilder();

        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '*') {
                if (i + 1 < segment.length() && segment.charAt(i + 1) == '*') {
                    buffer.append("**");
                    i++;
                } else {
                    output.append(LatexText.monospace(buffer.toString()));
                    buffer.setLength(0);
                    output.append(CENTERED_DOT);
                }
                continue;
            }
            buffer.append(c);
        }

        output.append(LatexText.monospace(buffer.toString()));
        return output.toString();
    }
}
