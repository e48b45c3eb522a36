package com.lendrisk.util;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-point helpers. All amounts, prices and rates carry 18 fractional digits.
 */
public final class Amounts {
    private Amounts() {}

    public static final int SCALE = 18;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    public static final BigDecimal ONE = BigDecimal.ONE.setScale(SCALE);

    /** Seconds in a 365-day year; annual rates are applied to the elapsed time in seconds. */
    public static final BigDecimal SECONDS_PER_YEAR = BigDecimal.valueOf(365L * 24 * 60 * 60);

    /** Share of a year between two instants, nanoseconds included. Zero when {@code to} is not after {@code from}. */
    public static BigDecimal yearFraction(Instant from, Instant to) {
        if (!to.isAfter(from)) return ZERO;
        Duration d = Duration.between(from, to);
        BigDecimal seconds = BigDecimal.valueOf(d.getSeconds()).add(BigDecimal.valueOf(d.getNano(), 9));
        return div(seconds, SECONDS_PER_YEAR);
    }

    public static BigDecimal of(BigDecimal v) {
        return v == null ? ZERO : v.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal of(String v) {
        return of(new BigDecimal(v));
    }

    public static BigDecimal mul(BigDecimal a, BigDecimal b) {
        return a.multiply(b).setScale(SCALE, ROUNDING);
    }

    public static BigDecimal div(BigDecimal a, BigDecimal b) {
        return a.divide(b, SCALE, ROUNDING);
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static boolean isPositive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }

    /** Validates a caller-supplied amount and normalizes its scale. */
    public static BigDecimal requirePositive(BigDecimal amount, String label) {
        if (!isPositive(amount)) {
            throw new LendingException(ErrorCode.INVALID_AMOUNT, label + " must be > 0, got " + amount);
        }
        return of(amount);
    }
}
