package com.lendrisk.rate;

import com.lendrisk.util.Amounts;

import java.math.BigDecimal;

/**
 * Maps pool utilization (0..1) to annual borrow and supply rates.
 * Implementations must be pure, continuous and non-decreasing in utilization.
 */
public interface InterestRateModel {

    /** Annual borrow rate for the given utilization. */
    BigDecimal borrowRate(BigDecimal utilization);

    /** supply = borrow × utilization × (1 − reserveFactor). */
    default BigDecimal supplyRate(BigDecimal utilization, BigDecimal reserveFactor) {
        BigDecimal keep = Amounts.ONE.subtract(reserveFactor);
        return Amounts.mul(Amounts.mul(borrowRate(utilization), utilization), keep);
    }
}
