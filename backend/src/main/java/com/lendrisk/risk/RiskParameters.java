package com.lendrisk.risk;

import java.math.BigDecimal;

/**
 * Protocol-wide risk settings before any credit-score adjustment.
 *
 * @param maxLoanToValue          highest debtValue / collateralValue a borrow may reach
 * @param liquidationThreshold    collateral weight in the health factor
 * @param liquidationBonus        extra collateral paid to liquidators on top of the repaid value
 * @param closeFactorHealthFactor at or below this health factor the whole debt may be liquidated
 * @param partialCloseFactor      share of the debt liquidatable above {@code closeFactorHealthFactor}
 */
public record RiskParameters(
        BigDecimal maxLoanToValue,
        BigDecimal liquidationThreshold,
        BigDecimal liquidationBonus,
        BigDecimal closeFactorHealthFactor,
        BigDecimal partialCloseFactor
) {}
