package io.github.cyfko.mathql.core.render;

/**
 * Escaping helpers for text placed inside LaTeX markup.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class LatexText {

    private static final String SPECIAL_CHARACTERS = "{}$&#_^%";

    private LatexText() {}

    /**
     * Escapes {@code value} for a text-mode group; line breaks become spaces.
     */
    static String escapeText(String value) {
        return escape(value, true);
    }

    /**
     * Escapes an identifier; line breaks cannot occur in identifiers and are kept as is.
     */
    static String escapeIdentifier(String value) {
        return escape(value, false);
    }

    /**
     * @return {@code \texttt{value}} with {@code value} escaped, or an empty string for empty input
     */
    static String monospace(String value) {
        return value.isEmpty() ? "" : "\\texttt{" + escapeText(value) + "}";
    }

    /**
     * @return {@code markup} tinted with {@code color}, or {@code markup} itself when no color is given
     */
    static String colored(String color, String markup) {
        if (color == null || color.isBlank()) {
            return markup;
        }
        return "\\textcolor{" + color + "}{" + markup + "}";
    }

    private static String escape(String value, boolean flattenLines) {
        StringBuilder out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\') {
                out.append("\\textbackslash{}");
            } else if (SPECIAL_CHARACTERS.indexOf(c) >= 0) {
                out.append('\\').append(c);
            } else if (flattenLines && c == '\n') {
                out.append(' ');
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
