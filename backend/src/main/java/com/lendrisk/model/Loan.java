package com.lendrisk.model;

import com.lendrisk.util.Amounts;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * A single borrow position: collateral locked in one asset against debt in another (or the same) asset.
 * The borrower owns the credit effects; the holder is whoever currently holds the loan document and is
 * the only party allowed to operate on it.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Loan {

    private final String loanId;
    private final String borrowerId;
    private String holderId;

    private final String collateralAssetId;
    private BigDecimal collateralAmount;

    private final String debtAssetId;
    private BigDecimal principal;
    private BigDecimal accruedInterest;
    private final BigDecimal interestRateAtOrigination;

    /** Balance the repayment tiers are measured against; grows with additional borrows. */
    private BigDecimal originationBalance;

    private LoanStatus status;
    private final Instant openedAt;
    private Instant lastUpdateTimestamp;

    /** Repayment tiers already rewarded for this loan. */
    private Set<String> awardedTiers;

    public static Loan open(String loanId, String borrowerId, String collateralAssetId, BigDecimal collateralAmount,
                            String debtAssetId, BigDecimal principal, BigDecimal rate, Instant now) {
        return Loan.builder()
                .loanId(loanId)
                .borrowerId(borrowerId)
                .holderId(borrowerId)
                .collateralAssetId(collateralAssetId)
                .collateralAmount(collateralAmount)
                .debtAssetId(debtAssetId)
                .principal(principal)
                .accruedInterest(Amounts.ZERO)
                .interestRateAtOrigination(rate)
                .originationBalance(principal)
                .status(LoanStatus.OPEN)
                .openedAt(now)
                .lastUpdateTimestamp(now)
                .awardedTiers(new HashSet<>())
                .build();
    }

    public Loan copy() {
        return toBuilder().awardedTiers(new HashSet<>(awardedTiers)).build();
    }

    public BigDecimal debt() {
        return principal.add(accruedInterest);
    }

    public boolean isActive() {
        return status.isActive();
    }

    public Set<String> getAwardedTiers() {
        return Collections.unmodifiableSet(awardedTiers);
    }

    // ---------- mutations ----------

    public void accrueInterest(BigDecimal interest, Instant now) {
        if (interest.signum() > 0) {
            accruedInterest = accruedInterest.add(interest);
        }
        if (now.isAfter(lastUpdateTimestamp)) {
            lastUpdateTimestamp = now;
        }
    }

    /**
     * Applies a repayment, interest first and then principal. Returns the amount applied,
     * which is clipped to the outstanding debt.
     */
    public BigDecimal applyRepayment(BigDecimal amount) {
        BigDecimal applied = Amounts.min(amount, debt());
        BigDecimal toInterest = Amounts.min(applied, accruedInterest);
        accruedInterest = accruedInterest.subtract(toInterest);
        principal = principal.subtract(applied.subtract(toInterest));
        return applied;
    }

    public void increasePrincipal(BigDecimal amount) {
        principal = principal.add(amount);
        originationBalance = originationBalance.add(amount);
    }

    public void addCollateral(BigDecimal amount) {
        collateralAmount = collateralAmount.add(amount);
    }

    public void removeCollateral(BigDecimal amount) {
        if (amount.compareTo(collateralAmount) > 0) {
            throw new IllegalStateException("loan " + loanId + " holds " + collateralAmount + " collateral, cannot remove " + amount);
        }
        collateralAmount = collateralAmount.subtract(amount);
    }

    public void markTierAwarded(String tierKey) {
        awardedTiers.add(tierKey);
    }

    public void transitionTo(LoanStatus next) {
        this.status = next;
    }

    public void reassignHolder(String newHolderId) {
        this.holderId = newHolderId;
    }
}
