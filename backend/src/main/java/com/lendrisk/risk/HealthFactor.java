package com.lendrisk.risk;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * (collateralValue × liquidationThreshold) / debtValue. A position without debt has an infinite
 * health factor and is always safe.
 */
public final class HealthFactor implements Comparable<HealthFactor> {

    public static final HealthFactor INFINITE = new HealthFactor(null);

    private final BigDecimal value;

    private HealthFactor(BigDecimal value) {
        this.value = value;
    }

    public static HealthFactor of(BigDecimal value) {
        return new HealthFactor(Objects.requireNonNull(value, "value"));
    }

    public boolean isInfinite() {
        return value == null;
    }

    /** Finite value; throws for {@link #INFINITE}. */
    public BigDecimal value() {
        if (value == null) throw new IllegalStateException("health factor is infinite");
        return value;
    }

    public boolean isAtOrBelow(BigDecimal bound) {
        return value != null && value.compareTo(bound) <= 0;
    }

    @Override
    public int compareTo(HealthFactor o) {
        if (isInfinite()) return o.isInfinite() ? 0 : 1;
        if (o.isInfinite()) return -1;
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HealthFactor other)) return false;
        return compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        return value == null ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value == null ? "INF" : value.stripTrailingZeros().toPlainString();
    }
}
