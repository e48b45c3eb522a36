package com.lendrisk.risk;

import java.math.BigDecimal;

/**
 * Benefits unlocked at {@code minScore}: a relaxation of the collateral terms and a cut in the borrow rate.
 */
public record CreditTier(int minScore, BigDecimal collateralDiscount, BigDecimal interestDiscount) {}
