package io.github.cyfko.mathql.core.config;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed symbol tables of the math expression language.
 * <p>
 * Every identifier an expression may reference is either one of the bound variables
 * (taken from {@link #VARIABLES}) or one of the names listed here. The tables are
 * immutable and shared process-wide; they are consumed by the namespace resolver,
 * the lexer and the identifier guard.
 * </p>
 *
 * <p>Functions and constants are written either bare ({@code sin(a)}, {@code PI}) or
 * namespaced ({@code Math.sin(a)}, {@code Math.PI}).</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MathAllowList {

    private MathAllowList() {}

    /**
     * Namespace under which functions and constants are resolved.
     */
    public static final String NAMESPACE = "Math";

    /**
     * Permitted function names, in display order.
     */
    public static final List<String> FUNCTION_NAMES = List.of(
            "abs",
            "acos",
            "acosh",
            "asin",
            "asinh",
            "atan",
            "atan2",
            "atanh",
            "cbrt",
            "ceil",
            "clz32",
            "cos",
            "cosh",
            "exp",
            "expm1",
            "floor",
            "fround",
            "hypot",
            "imul",
            "log",
            "log1p",
            "log2",
            "log10",
            "max",
            "min",
            "pow",
            "round",
            "sign",
            "sin",
            "sinh",
            "sqrt",
            "tan",
            "tanh",
            "trunc"
    );

    /**
     * Permitted named constants, in display order.
     */
    public static final List<String> CONSTANT_NAMES = List.of(
            "E",
            "LN2",
            "LN10",
            "LOG2E",
            "LOG10E",
            "PI",
            "SQRT1_2",
            "SQRT2"
    );

    /**
     * The variable alphabet available for binding to source channels.
     */
    public static final List<String> VARIABLES = List.of("a", "b", "c", "d", "e", "f", "g", "h");

    public static final int VARIABLE_ALPHABET_SIZE = VARIABLES.size();

    /** Comma separated function list, as shown in syntax help. */
    public static final String FUNCTION_LABEL = String.join(", ", FUNCTION_NAMES);

    /** Comma separated constant list, as shown in syntax help. */
    public static final String CONSTANT_LABEL = String.join(", ", CONSTANT_NAMES);

    /**
     * Identifiers accepted by the identifier guard regardless of the bound variables.
     */
    public static final Set<String> ALLOWED_IDENTIFIERS;

    private static final Set<String> FUNCTIONS = Set.copyOf(FUNCTION_NAMES);
    private static final Set<String> CONSTANTS = Set.copyOf(CONSTANT_NAMES);

    static {
        Set<String> allowed = new LinkedHashSet<>();
        allowed.add(NAMESPACE);
        allowed.addAll(FUNCTION_NAMES);
        allowed.addAll(CONSTANT_NAMES);
        ALLOWED_IDENTIFIERS = Set.copyOf(allowed);
    }

    public static boolean isFunction(String name) {
        return name != null && FUNCTIONS.contains(name);
    }

    public static boolean isConstant(String name) {
        return name != null && CONSTANTS.contains(name);
    }

    /**
     * Tells whether {@code identifier} is accepted without being a bound variable.
     *
     * @param identifier the identifier to test
     * @return {@code true} for the namespace itself and every allow-listed function or constant
     */
    public static boolean isAllowedIdentifier(String identifier) {
        return identifier != null && ALLOWED_IDENTIFIERS.contains(identifier);
    }
}
