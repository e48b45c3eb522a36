package com.lendrisk.rate;

import com.lendrisk.util.Amounts;

import java.math.BigDecimal;

/**
 * Two-slope rate curve. Below the optimal utilization U* the rate climbs linearly from
 * {@code baseRate} by {@code slopeLow}; above U* it climbs by {@code slopeHigh} over the
 * remaining (1 − U*) range. The curve is continuous at U*.
 */
public final class KinkedInterestRateModel implements InterestRateModel {

    private final BigDecimal baseRate;
    private final BigDecimal optimalUtilization;
    private final BigDecimal slopeLow;
    private final BigDecimal slopeHigh;

    public KinkedInterestRateModel(BigDecimal baseRate, BigDecimal optimalUtilization,
                                   BigDecimal slopeLow, BigDecimal slopeHigh) {
        if (baseRate.signum() < 0 || slopeLow.signum() < 0 || slopeHigh.signum() < 0) {
            throw new IllegalArgumentException("rate parameters must be >= 0");
        }
        if (optimalUtilization.signum() <= 0 || optimalUtilization.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("optimalUtilization must be in (0, 1): " + optimalUtilization);
        }
        this.baseRate = Amounts.of(baseRate);
        this.optimalUtilization = Amounts.of(optimalUtilization);
        this.slopeLow = Amounts.of(slopeLow);
        this.slopeHigh = Amounts.of(slopeHigh);
    }

    @Override
    public BigDecimal borrowRate(BigDecimal utilization) {
        BigDecimal u = clamp(utilization);
        if (u.compareTo(optimalUtilization) <= 0) {
            return baseRate.add(Amounts.div(Amounts.mul(slopeLow, u), optimalUtilization));
        }
        BigDecimal excess = Amounts.div(u.subtract(optimalUtilization), Amounts.ONE.subtract(optimalUtilization));
        return baseRate.add(slopeLow).add(Amounts.mul(slopeHigh, excess));
    }

    private static BigDecimal clamp(BigDecimal u) {
        if (u == null || u.signum() <= 0) return Amounts.ZERO;
        if (u.compareTo(BigDecimal.ONE) >= 0) return Amounts.ONE;
        return Amounts.of(u);
    }

    public BigDecimal getBaseRate() { return baseRate; }
    public BigDecimal getOptimalUtilization() { return optimalUtilization; }
    public BigDecimal getSlopeLow() { return slopeLow; }
    public BigDecimal getSlopeHigh() { return slopeHigh; }
}
