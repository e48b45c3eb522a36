package com.lendrisk.liquidation;

import com.lendrisk.credit.CreditScorer;
import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import com.lendrisk.model.CreditRecord;
import com.lendrisk.model.Loan;
import com.lendrisk.model.LoanStatus;
import com.lendrisk.model.Pool;
import com.lendrisk.model.RepaymentSource;
import com.lendrisk.price.PriceFeed;
import com.lendrisk.price.PriceSnapshot;
import com.lendrisk.risk.HealthFactor;
import com.lendrisk.risk.RiskEngine;
import com.lendrisk.util.Amounts;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Executes a liquidation against staged copies of a loan, its two pools and the borrower's record.
 *
 * <p>Interest must already be accrued on the loan. On any rejection the staged objects may be left
 * half-updated; the caller discards them. Both prices are read once, so the health factors before and
 * after are computed at the same quotes.
 *
 * <p>Collateral left in a loan that the liquidation closes goes to the loan's holder, the same party
 * a full repayment releases it to. Credit effects always go to the borrower.
 */
public final class LiquidationEngine {

    private final RiskEngine risk;
    private final CreditScorer scorer;

    public LiquidationEngine(RiskEngine risk, CreditScorer scorer) {
        this.risk = risk;
        this.scorer = scorer;
    }

    public LiquidationResult liquidate(Loan loan, Pool debtPool, Pool collateralPool,
                                       CreditRecord borrower, CreditRecord holder,
                                       String liquidatorId, BigDecimal repayAmount,
                                       PriceFeed feed, Instant now) {
        if (!holder.getUserId().equals(loan.getHolderId())) {
            throw new IllegalArgumentException("Record " + holder.getUserId() + " does not hold loan " + loan.getLoanId());
        }
        if (!loan.isActive()) {
            throw new LendingException(ErrorCode.NOT_LIQUIDATABLE, "Loan " + loan.getLoanId() + " is closed");
        }
        PriceFeed prices = PriceSnapshot.of(feed, loan.getDebtAssetId(), loan.getCollateralAssetId());
        int score = borrower.getCreditScore();
        HealthFactor before = risk.healthFactor(loan, prices, score);
        if (!risk.isLiquidatable(before)) {
            throw new LendingException(ErrorCode.NOT_LIQUIDATABLE,
                    "Loan " + loan.getLoanId() + " has health factor " + before + " > 1");
        }
        BigDecimal max = risk.maxLiquidatable(loan, before);
        if (repayAmount.compareTo(max) > 0) {
            throw new LendingException(ErrorCode.EXCEEDS_LIQUIDATION_LIMIT,
                    "Repay " + plain(repayAmount) + " exceeds the limit " + plain(max)
                            + " at health factor " + before);
        }

        BigDecimal seizure = seizureFor(repayAmount, loan, prices);
        BigDecimal available = loan.getCollateralAmount();
        boolean capped = seizure.compareTo(available) > 0;
        BigDecimal seized = capped ? available : seizure;
        BigDecimal shortfall = capped ? seizure.subtract(available) : Amounts.ZERO;
        if (capped && repayAmount.compareTo(loan.debt()) < 0) {
            throw new LendingException(ErrorCode.PARTIAL_SEIZURE_SHORTFALL,
                    "Loan " + loan.getLoanId() + " holds " + plain(available) + " collateral, seizure needs "
                            + plain(seizure) + "; only a full repayment may absorb the shortfall");
        }

        BigDecimal applied = loan.applyRepayment(repayAmount);
        debtPool.repay(applied, now);
        loan.removeCollateral(seized);
        collateralPool.removeCollateral(seized);

        BigDecimal released = Amounts.ZERO;
        if (loan.debt().signum() == 0) {
            released = loan.getCollateralAmount();
            if (released.signum() > 0) {
                loan.removeCollateral(released);
                holder.addCollateral(loan.getCollateralAssetId(), released);
            }
            loan.transitionTo(LoanStatus.CLOSED);
        } else {
            loan.transitionTo(LoanStatus.PARTIALLY_LIQUIDATED);
        }

        HealthFactor after = loan.getStatus() == LoanStatus.CLOSED
                ? HealthFactor.INFINITE
                : risk.healthFactor(loan, prices, score);
        if (after.compareTo(before) <= 0) {
            throw new LendingException(ErrorCode.HEALTH_NOT_IMPROVED,
                    "Liquidation of " + plain(repayAmount) + " would move health factor " + before + " -> " + after);
        }

        borrower.incrementDefaults();
        scorer.onRepayment(borrower, loan, applied, RepaymentSource.LIQUIDATION, now);

        return LiquidationResult.builder()
                .loanId(loan.getLoanId())
                .liquidatorId(liquidatorId)
                .repaid(applied)
                .collateralSeized(seized)
                .collateralReleased(released)
                .healthBefore(before)
                .healthAfter(after)
                .status(loan.getStatus())
                .seizureShortfall(capped)
                .shortfall(shortfall)
                .build();
    }

    /** (repay × debtPrice / collateralPrice) × (1 + bonus), in collateral units. */
    public BigDecimal seizureFor(BigDecimal repayAmount, Loan loan, PriceFeed prices) {
        BigDecimal repaidValue = risk.value(repayAmount, loan.getDebtAssetId(), prices);
        BigDecimal base = Amounts.div(repaidValue, prices.getPrice(loan.getCollateralAssetId()));
        return Amounts.mul(base, BigDecimal.ONE.add(risk.getParams().liquidationBonus()));
    }

    private static String plain(BigDecimal v) {
        return v.stripTrailingZeros().toPlainString();
    }
}
