package com.lendrisk.credit;

import com.lendrisk.model.CreditRecord;
import com.lendrisk.model.Loan;
import com.lendrisk.model.RepaymentEvent;
import com.lendrisk.model.RepaymentSource;
import com.lendrisk.util.Amounts;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Raises credit scores on repayment, from a table of remaining-balance tiers.
 *
 * <p>Each tier pays out at most once per loan, so splitting a repayment into small pieces earns nothing
 * extra. Scores never decrease and stop at the configured ceiling.
 */
public final class CreditScorer {

    private final List<RepaymentTier> tiers;
    private final int scoreCeiling;

    public CreditScorer(List<RepaymentTier> tiers, int scoreCeiling) {
        if (scoreCeiling < 0) throw new IllegalArgumentException("scoreCeiling must be >= 0");
        for (RepaymentTier t : tiers) {
            if (t.remainingFraction().signum() < 0 || t.remainingFraction().compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException("remainingFraction must be in [0, 1]: " + t.remainingFraction());
            }
            if (t.points() < 0) throw new IllegalArgumentException("points must be >= 0: " + t.points());
        }
        this.tiers = tiers.stream()
                .sorted(Comparator.comparing(RepaymentTier::remainingFraction).reversed())
                .toList();
        this.scoreCeiling = scoreCeiling;
    }

    /**
     * Records a repayment already applied to {@code loan} and credits the borrower's record.
     *
     * @param record borrower's record (not the holder's)
     * @param applied amount that actually reduced the debt
     * @return score points gained
     */
    public int onRepayment(CreditRecord record, Loan loan, BigDecimal applied, RepaymentSource source, Instant now) {
        BigDecimal remaining = remainingFraction(loan);
        int points = 0;
        for (RepaymentTier tier : tiers) {
            if (!reached(tier, loan, remaining)) continue;
            String key = tier.key();
            if (loan.getAwardedTiers().contains(key)) continue;
            loan.markTierAwarded(key);
            points += tier.points();
        }
        int gained = record.raiseScore(points, scoreCeiling);
        record.recordRepayment(RepaymentEvent.builder()
                .loanId(loan.getLoanId())
                .assetId(loan.getDebtAssetId())
                .amount(applied)
                .remainingBalance(loan.debt())
                .source(source)
                .scoreAwarded(gained)
                .ts(now)
                .build());
        return gained;
    }

    private static boolean reached(RepaymentTier tier, Loan loan, BigDecimal remaining) {
        if (tier.remainingFraction().signum() == 0) return loan.debt().signum() == 0;
        return remaining.compareTo(tier.remainingFraction()) <= 0;
    }

    private static BigDecimal remainingFraction(Loan loan) {
        if (loan.getOriginationBalance().signum() == 0) return Amounts.ZERO;
        return Amounts.div(loan.debt(), loan.getOriginationBalance());
    }
}
