package io.github.cyfko.mathql.core.eval;

import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Implementations of the allow-listed functions.
 * <p>
 * Semantics follow the usual scripting-language {@code Math} object: {@code round} rounds
 * half up, {@code atan2} takes {@code (y, x)}, {@code imul} and {@code clz32} work on 32-bit
 * integer conversions, {@code hypot}, {@code max} and {@code min} accept any number of
 * arguments. Every other function has a fixed arity.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum MathFunction {

    ABS("abs", 1, args -> Math.abs(args[0])),
    ACOS("acos", 1, args -> Math.acos(args[0])),
    ACOSH("acosh", 1, args -> acosh(args[0])),
    ASIN("asin", 1, args -> Math.asin(args[0])),
    ASINH("asinh", 1, args -> asinh(args[0])),
    ATAN("atan", 1, args -> Math.atan(args[0])),
    ATAN2("atan2", 2, args -> Math.atan2(args[0], args[1])),
    ATANH("atanh", 1, args -> atanh(args[0])),
    CBRT("cbrt", 1, args -> Math.cbrt(args[0])),
    CEIL("ceil", 1, args -> Math.ceil(args[0])),
    CLZ32("clz32", 1, args -> Integer.numberOfLeadingZeros(toInt32(args[0]))),
    COS("cos", 1, args -> Math.cos(args[0])),
    COSH("cosh", 1, args -> Math.cosh(args[0])),
    EXP("exp", 1, args -> Math.exp(args[0])),
    EXPM1("expm1", 1, args -> Math.expm1(args[0])),
    FLOOR("floor", 1, args -> Math.floor(args[0])),
    FROUND("fround", 1, args -> (double) (float) args[0]),
    HYPOT("hypot", 0, Integer.MAX_VALUE, MathFunction::hypot),
    IMUL("imul", 2, args -> toInt32(args[0]) * toInt32(args[1])),
    LOG("log", 1, args -> Math.log(args[0])),
    LOG1P("log1p", 1, args -> Math.log1p(args[0])),
    LOG2("log2", 1, args -> log2(args[0])),
    LOG10("log10", 1, args -> Math.log10(args[0])),
    MAX("max", 0, Integer.MAX_VALUE, MathFunction::max),
    MIN("min", 0, Integer.MAX_VALUE, MathFunction::min),
    POW("pow", 2, args -> power(args[0], args[1])),
    ROUND("round", 1, args -> round(args[0])),
    SIGN("sign", 1, args -> Math.signum(args[0])),
    SIN("sin", 1, args -> Math.sin(args[0])),
    SINH("sinh", 1, args -> Math.sinh(args[0])),
    SQRT("sqrt", 1, args -> Math.sqrt(args[0])),
    TAN("tan", 1, args -> Math.tan(args[0])),
    TANH("tanh", 1, args -> Math.tanh(args[0])),
    TRUNC("trunc", 1, args -> trunc(args[0]));

    private static final Map<String, MathFunction> BY_NAME = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(MathFunction::functionName, f -> f));

    private static final double TWO_POW_32 = 4294967296.0;

    private final String functionName;
    private final int minArgs;
    private final int maxArgs;
    private final ToDoubleFunction<double[]> implementation;

    MathFunction(String functionName, int arity, ToDoubleFunction<double[]> implementation) {
        this(functionName, arity, arity, implementation);
    }

    MathFunction(String functionName, int minArgs, int maxArgs, ToDoubleFunction<double[]> implementation) {
        this.functionName = functionName;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.implementation = implementation;
    }

    public String functionName() {
        return functionName;
    }

    public boolean isVariadic() {
        return maxArgs == Integer.MAX_VALUE;
    }

    public boolean acceptsArity(int count) {
        return count >= minArgs && count <= maxArgs;
    }

    /**
     * Describes the accepted argument count, e.g. {@code "2"} or {@code "any number of"}.
     */
    public String arityDescription() {
        if (isVariadic()) return "any number of";
        return minArgs == maxArgs ? String.valueOf(minArgs) : minArgs + " to " + maxArgs;
    }

    /**
     * Applies the function. The caller is responsible for checking {@link #acceptsArity(int)}.
     *
     * @param args evaluated arguments
     * @return the result, possibly NaN or infinite
     */
    public double apply(double... args) {
        return implementation.applyAsDouble(args);
    }

    public static Optional<MathFunction> fromName(String name) {
        return Optional.ofNullable(name == null ? null : BY_NAME.get(name));
    }

    /**
     * Exponentiation shared by {@code pow} and the {@code ^} operator.
     * <p>
     * A base of magnitude one raised to an infinite exponent is NaN, as in scripting hosts.
     * </p>
     */
    static double power(double base, double exponent) {
        if (Double.isInfinite(exponent) && Math.abs(base) == 1.0) {
            return Double.NaN;
        }
        return Math.pow(base, exponent);
    }

    static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double floor = Math.floor(value);
        return value - floor >= 0.5 ? floor + 1.0 : floor;
    }

    static double trunc(double value) {
        return value < 0 ? Math.ceil(value) : Math.floor(value);
    }

    static double log2(double value) {
        if (value >= Double.MIN_NORMAL && !Double.isInfinite(value)) {
            int exponent = Math.getExponent(value);
            if (value == Math.scalb(1.0, exponent)) {
                return exponent;
            }
        }
        return Math.log(value) / Math.log(2.0);
    }

    static double asinh(double value) {
        if (value == 0.0 || Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double magnitude = Math.abs(value);
        return Math.copySign(Math.log(magnitude + Math.sqrt(magnitude * magnitude + 1.0)), value);
    }

    static double acosh(double value) {
        if (value < 1.0) {
            return Double.NaN;
        }
        return Math.log(value + Math.sqrt(value * value - 1.0));
    }

    static double atanh(double value) {
        return 0.5 * Math.log((1.0 + value) / (1.0 - value));
    }

    /**
     * ToInt32 conversion: truncation modulo 2^32, NaN and infinities map to zero.
     */
    static int toInt32(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0;
        }
        double truncated = trunc(value) % TWO_POW_32;
        return (int) (long) truncated;
    }

    private static double hypot(double[] args) {
        double result = 0.0;
        for (double arg : args) {
            result = Math.hypot(result, arg);
        }
        return result;
    }

    private static double max(double[] args) {
        double result = Double.NEGATIVE_INFINITY;
        for (double arg : args) {
            result = Math.max(result, arg);
        }
        return result;
    }

    private static double min(double[] args) {
        double result = Double.POSITIVE_INFINITY;
        for (double arg : args) {
            result = Math.min(result, arg);
        }
        return result;
    }
}
