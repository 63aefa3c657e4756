package io.github.cyfko.mathql.core.eval;

import java.util.Optional;

/**
 * Values of the allow-listed named constants.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum MathConstant {
    E(Math.E),
    LN2(Math.log(2.0)),
    LN10(Math.log(10.0)),
    LOG2E(1.0 / Math.log(2.0)),
    LOG10E(1.0 / Math.log(10.0)),
    PI(Math.PI),
    SQRT1_2(Math.sqrt(0.5)),
    SQRT2(Math.sqrt(2.0));

    private final double value;

    MathConstant(double value) {
        this.value = value;
    }

    public double value() {
        return value;
    }

    public static Optional<MathConstant> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (MathConstant constant : values()) {
            if (constant.name().equals(name)) return Optional.of(constant);
        }
        return Optional.empty();
    }
}
