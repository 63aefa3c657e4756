package io.github.cyfko.mathql.core.parsing;

import io.github.cyfko.mathql.core.config.MathAllowList;
import io.github.cyfko.mathql.core.utils.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static identifier check run before any evaluation.
 * <p>
 * Every word-bounded identifier of the (namespaced) expression must be either a bound
 * variable name or an entry of {@link MathAllowList#ALLOWED_IDENTIFIERS}. Rendering does not
 * use this guard: previews show unknown identifiers as plain text.
 * </p>
 *
 * <pre>{@code
 * IdentifierGuard.checkIdentifiers("Math.sin(a)", Set.of("a"));        // valid
 * IdentifierGuard.checkIdentifiers("a + window.length", Set.of("a"));  // rejected: window
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class IdentifierGuard {

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("\\b[A-Za-z_]\\w*\\b");

    private IdentifierGuard() {}

    /**
     * Checks the identifiers of {@code expression}.
     *
     * @param expression         expression, normally already processed by {@link NamespaceResolver}
     * @param boundVariableNames names of the variables bound for the evaluation
     * @return success, or a rejection naming the first offending identifier
     */
    public static ValidationResult checkIdentifiers(String expression, Set<String> boundVariableNames) {
        Set<String> bound = boundVariableNames == null ? Set.of() : boundVariableNames;
        for (String identifier : extractIdentifiers(expression)) {
            if (bound.contains(identifier)) {
                continue;
            }
            if (!MathAllowList.isAllowedIdentifier(identifier)) {
                return ValidationResult.rejected(identifier);
            }
        }
        return ValidationResult.success();
    }

    /**
     * @return the identifiers of {@code expression} in source order, duplicates included
     */
    public static List<String> extractIdentifiers(String expression) {
        List<String> identifiers = new ArrayList<>();
        if (expression == null) {
            return identifiers;
        }
        Matcher matcher = IDENTIFIER_PATTERN.matcher(expression);
        while (matcher.find()) {
            identifiers.add(matcher.group());
        }
        return identifiers;
    }
}
