package com.lendrisk.api.dto;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.liquidation.LiquidationResult;
import com.lendrisk.model.LoanStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class LiquidationView {
    private String loanId;
    private String liquidatorId;
    private BigDecimal repaid;
    private BigDecimal collateralSeized;
    private BigDecimal collateralReleased;
    /** Null when infinite (loan closed). */
    private BigDecimal healthBefore;
    private BigDecimal healthAfter;
    private LoanStatus status;

    /** Set to PARTIAL_SEIZURE_SHORTFALL when the protocol absorbed bad debt. */
    private String warning;
    private BigDecimal shortfall;

    public static LiquidationView from(LiquidationResult r) {
        return LiquidationView.builder()
                .loanId(r.getLoanId())
                .liquidatorId(r.getLiquidatorId())
                .repaid(r.getRepaid())
                .collateralSeized(r.getCollateralSeized())
                .collateralReleased(r.getCollateralReleased())
                .healthBefore(r.getHealthBefore().isInfinite() ? null : r.getHealthBefore().value())
                .healthAfter(r.getHealthAfter().isInfinite() ? null : r.getHealthAfter().value())
                .status(r.getStatus())
                .warning(r.isSeizureShortfall() ? ErrorCode.PARTIAL_SEIZURE_SHORTFALL.name() : null)
                .shortfall(r.getShortfall())
                .build();
    }
}
