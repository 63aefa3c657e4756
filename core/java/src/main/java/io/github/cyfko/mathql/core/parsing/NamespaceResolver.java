package io.github.cyfko.mathql.core.parsing;

import io.github.cyfko.mathql.core.config.MathAllowList;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String-level rewriting applied before tokenizing.
 * <p>
 * Users may write allow-listed functions and constants without the namespace ({@code sin(a)},
 * {@code PI}); this class prefixes them with {@code Math.} so that the lexer only has to
 * recognise the namespaced form. It also folds the legacy power spelling {@code **} into the
 * canonical {@code ^}.
 * </p>
 *
 * <ul>
 *   <li>a function name is rewritten only when followed (after optional blanks) by {@code (}</li>
 *   <li>a constant name is rewritten only when it is not glued to a word character or a dot</li>
 *   <li>names inside longer identifiers and already namespaced names (including the spaced
 *       form {@code Math . PI}) are left untouched, so the rewrite is idempotent</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NamespaceResolver {

    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
            "(^|[^\\w.])(" + String.join("|", MathAllowList.FUNCTION_NAMES) + ")\\s*(?=\\()");

    private static final Pattern CONSTANT_PATTERN = Pattern.compile(
            "(^|[^\\w.])(" + String.join("|", MathAllowList.CONSTANT_NAMES) + ")(?![\\w.])");

    private static final String LEGACY_POWER = "**";
    private static final String CANONICAL_POWER = "^";

    private NamespaceResolver() {}

    /**
     * Applies {@link #attachNamespace(String)} then {@link #canonicalizePower(String)}.
     *
     * @param expression raw expression
     * @return the namespaced expression using {@code ^} for powers
     */
    public static String resolve(String expression) {
        return canonicalizePower(attachNamespace(expression));
    }

    /**
     * Prefixes bare allow-listed functions and constants with {@code Math.}.
     *
     * @param expression raw expression
     * @return the rewritten expression
     */
    public static String attachNamespace(String expression) {
        String withFunctions = prefixMatches(FUNCTION_PATTERN, expression);
        return prefixMatches(CONSTANT_PATTERN, withFunctions);
    }

    /**
     * Replaces every {@code **} with {@code ^}.
     */
    public static String canonicalizePower(String expression) {
        return expression.replace(LEGACY_POWER, CANONICAL_POWER);
    }

    private static String prefixMatches(Pattern pattern, String input) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder out = new StringBuilder(input.length() + 16);
        while (matcher.find()) {
            if (followsMemberDot(input, matcher.start(2))) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            String replacement = matcher.group(1) + MathAllowList.NAMESPACE + "." + matcher.group(2);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static boolean followsMemberDot(String input, int nameStart) {
        int i = nameStart - 1;
        while (i >= 0 && Character.isWhitespace(input.charAt(i))) {
            i--;
        }
        return i >= 0 && input.charAt(i) == '.';
    }
}
