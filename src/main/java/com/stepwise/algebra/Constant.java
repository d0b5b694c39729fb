package com.stepwise.algebra;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * A numeric literal. The value is stored without trailing zeros so that {@code 2.0} and {@code 2}
 * compare equal.
 */
public record Constant(BigDecimal value) implements Node {

    public static final Constant ZERO = new Constant(BigDecimal.ZERO);
    public static final Constant ONE = new Constant(BigDecimal.ONE);

    public Constant {
        Objects.requireNonNull(value, "value");
        value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    public static Constant of(long value) {
        return new Constant(BigDecimal.valueOf(value));
    }

    public static Constant of(BigInteger value) {
        return new Constant(new BigDecimal(value));
    }

    public boolean isNegative() {
        return value.signum() < 0;
    }

    public boolean isInteger() {
        return value.scale() <= 0;
    }

    /**
     * @return {@code true} if this constant is numerically equal to {@code other}.
     */
    public boolean hasValue(long other) {
        return value.compareTo(BigDecimal.valueOf(other)) == 0;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return NodeFormatter.format(this);
    }
}
