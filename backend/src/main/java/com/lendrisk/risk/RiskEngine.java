package com.lendrisk.risk;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import com.lendrisk.model.Loan;
import com.lendrisk.model.Pool;
import com.lendrisk.price.PriceFeed;
import com.lendrisk.util.Amounts;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;

/**
 * Central risk decisions: health factor, borrow gating and liquidation sizing.
 *
 * <p>Pure logic class. No repositories, no logging, no state of its own; every answer depends only on
 * the loan, pool, prices and credit score passed in.
 */
public final class RiskEngine {

    private final RiskParameters params;
    /** Sorted by minScore descending so the first match is the best tier reached. */
    private final List<CreditTier> tiers;

    public RiskEngine(RiskParameters params, List<CreditTier> tiers) {
        this.params = params;
        this.tiers = tiers.stream()
                .sorted(Comparator.comparingInt(CreditTier::minScore).reversed())
                .toList();
    }

    public RiskParameters getParams() {
        return params;
    }

    // ---------- credit-adjusted terms ----------

    public RiskTerms termsFor(int creditScore) {
        CreditTier tier = tierFor(creditScore);
        BigDecimal collateralDiscount = tier == null ? Amounts.ZERO : tier.collateralDiscount();
        BigDecimal interestDiscount = tier == null ? Amounts.ZERO : tier.interestDiscount();
        return new RiskTerms(
                params.maxLoanToValue().add(collateralDiscount),
                params.liquidationThreshold().add(collateralDiscount),
                interestDiscount);
    }

    /** Pool borrow rate minus the borrower's credit discount, never below zero. */
    public BigDecimal borrowRateFor(Pool debtPool, int creditScore) {
        BigDecimal rate = debtPool.borrowRate().subtract(termsFor(creditScore).interestDiscount());
        return Amounts.max(Amounts.ZERO, rate);
    }

    private CreditTier tierFor(int creditScore) {
        for (CreditTier t : tiers) {
            if (creditScore >= t.minScore()) return t;
        }
        return null;
    }

    // ---------- valuation ----------

    public BigDecimal value(BigDecimal amount, String assetId, PriceFeed prices) {
        return Amounts.mul(amount, prices.getPrice(assetId));
    }

    public HealthFactor healthFactor(Loan loan, PriceFeed prices, int creditScore) {
        return healthFactor(loan.getCollateralAmount(), loan.getCollateralAssetId(),
                loan.debt(), loan.getDebtAssetId(), prices, creditScore);
    }

    public HealthFactor healthFactor(BigDecimal collateralAmount, String collateralAssetId,
                                     BigDecimal debt, String debtAssetId,
                                     PriceFeed prices, int creditScore) {
        BigDecimal debtValue = value(debt, debtAssetId, prices);
        if (debtValue.signum() == 0) return HealthFactor.INFINITE;
        BigDecimal collateralValue = value(collateralAmount, collateralAssetId, prices);
        BigDecimal weighted = Amounts.mul(collateralValue, termsFor(creditScore).liquidationThreshold());
        return HealthFactor.of(Amounts.div(weighted, debtValue));
    }

    // ---------- borrow gating ----------

    /**
     * Rejects with EXCEEDS_MAX_BORROW unless {@code debtValue / collateralValue <= maxLoanToValue}
     * for the position as it would be after the borrow.
     */
    public void checkBorrow(BigDecimal collateralAmount, String collateralAssetId,
                            BigDecimal resultingDebt, String debtAssetId,
                            PriceFeed prices, int creditScore) {
        BigDecimal debtValue = value(resultingDebt, debtAssetId, prices);
        BigDecimal limit = borrowLimitValue(collateralAmount, collateralAssetId, prices, creditScore);
        if (debtValue.compareTo(limit) > 0) {
            throw new LendingException(ErrorCode.EXCEEDS_MAX_BORROW,
                    "Debt value " + plain(debtValue) + " would exceed the borrow limit " + plain(limit)
                            + " (max LTV " + plain(termsFor(creditScore).maxLoanToValue()) + ")");
        }
    }

    /** Additional debt (in debt-asset units) the position can still take; zero when already at the limit. */
    public BigDecimal maxAdditionalBorrow(BigDecimal collateralAmount, String collateralAssetId,
                                          BigDecimal currentDebt, String debtAssetId,
                                          PriceFeed prices, int creditScore) {
        BigDecimal limit = borrowLimitValue(collateralAmount, collateralAssetId, prices, creditScore);
        BigDecimal headroomValue = limit.subtract(value(currentDebt, debtAssetId, prices));
        if (headroomValue.signum() <= 0) return Amounts.ZERO;
        return Amounts.div(headroomValue, prices.getPrice(debtAssetId)).setScale(Amounts.SCALE, RoundingMode.DOWN);
    }

    private BigDecimal borrowLimitValue(BigDecimal collateralAmount, String collateralAssetId,
                                        PriceFeed prices, int creditScore) {
        return Amounts.mul(value(collateralAmount, collateralAssetId, prices), termsFor(creditScore).maxLoanToValue());
    }

    // ---------- liquidation ----------

    public boolean isLiquidatable(HealthFactor hf) {
        return hf.isAtOrBelow(BigDecimal.ONE);
    }

    /**
     * Largest repayment a liquidator may make: nothing above a health factor of 1, the partial close
     * factor of the debt down to the close-factor bound (exclusive), the whole debt at or below it.
     */
    public BigDecimal maxLiquidatable(Loan loan, HealthFactor hf) {
        if (!isLiquidatable(hf)) return Amounts.ZERO;
        if (hf.isAtOrBelow(params.closeFactorHealthFactor())) return loan.debt();
        return Amounts.mul(loan.debt(), params.partialCloseFactor());
    }

    private static String plain(BigDecimal v) {
        return v.stripTrailingZeros().toPlainString();
    }
}
