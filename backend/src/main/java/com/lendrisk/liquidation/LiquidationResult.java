package com.lendrisk.liquidation;

import com.lendrisk.model.LoanStatus;
import com.lendrisk.risk.HealthFactor;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/** Outcome of a committed liquidation. */
@Value
@Builder
public class LiquidationResult {
    String loanId;
    String liquidatorId;
    BigDecimal repaid;
    /** Collateral transferred to the liquidator, bonus included. */
    BigDecimal collateralSeized;
    /** Collateral handed back to the borrower when the liquidation closed the loan. */
    BigDecimal collateralReleased;
    HealthFactor healthBefore;
    HealthFactor healthAfter;
    LoanStatus status;

    /** True when the collateral could not cover the computed seizure: the protocol absorbed bad debt. */
    boolean seizureShortfall;
    /** Collateral units missing from the seizure; zero unless {@link #seizureShortfall}. */
    BigDecimal shortfall;
}
