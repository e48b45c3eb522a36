package com.lendrisk.service;

import com.lendrisk.model.Loan;
import com.lendrisk.model.Pool;
import com.lendrisk.risk.RiskEngine;
import com.lendrisk.util.Amounts;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Lazy interest: brings a loan and its debt pool forward to {@code now}.
 * Works on whatever copies it is given; callers decide whether the result gets published.
 */
final class InterestAccrual {

    private final RiskEngine risk;

    InterestAccrual(RiskEngine risk) {
        this.risk = risk;
    }

    /** Returns the interest added to the loan. */
    BigDecimal accrue(Loan loan, Pool debtPool, int borrowerScore, Instant now) {
        // rate as of the last update, before this touch moves utilization
        BigDecimal rate = risk.borrowRateFor(debtPool, borrowerScore);
        debtPool.accrueIndices(now);
        if (!loan.isActive() || !now.isAfter(loan.getLastUpdateTimestamp())) {
            loan.accrueInterest(Amounts.ZERO, now);
            return Amounts.ZERO;
        }
        BigDecimal yearFraction = Amounts.yearFraction(loan.getLastUpdateTimestamp(), now);
        BigDecimal interest = Amounts.mul(Amounts.mul(loan.debt(), rate), yearFraction);
        loan.accrueInterest(interest, now);
        debtPool.bookInterest(interest);
        return interest;
    }
}
