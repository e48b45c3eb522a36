package com.lendrisk.credit;

import java.math.BigDecimal;

/**
 * Points earned the first time a loan's remaining balance drops to {@code remainingFraction}
 * of its origination balance or below. A fraction of 0 means fully repaid.
 */
public record RepaymentTier(BigDecimal remainingFraction, int points) {

    String key() {
        return remainingFraction.stripTrailingZeros().toPlainString();
    }
}
