package io.github.cyfko.mathql.core.api;

/**
 * Outcome of {@link ExpressionEngine#render(String, java.util.Map)}.
 *
 * @param markup typeset (LaTeX) markup, empty when nothing could be rendered
 * @param error  reason why nothing could be rendered, {@code null} otherwise
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ExpressionPreview(String markup, String error) {

    private static final ExpressionPreview EMPTY = new ExpressionPreview("", null);

    public ExpressionPreview {
        markup = markup == null ? "" : markup;
    }

    /**
     * @return the preview of an empty expression: no markup and no error
     */
    public static ExpressionPreview empty() {
        return EMPTY;
    }

    public static ExpressionPreview of(String markup) {
        return new ExpressionPreview(markup, null);
    }

    public static ExpressionPreview failure(String error) {
        return new ExpressionPreview("", error);
    }

    public boolean hasError() {
        return error != null;
    }
}
