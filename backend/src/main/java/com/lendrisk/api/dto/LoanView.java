package com.lendrisk.api.dto;

import com.lendrisk.model.Loan;
import com.lendrisk.model.LoanStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
public class LoanView {
    private String loanId;
    private String borrowerId;
    private String holderId;
    private String collateralAssetId;
    private BigDecimal collateralAmount;
    private String debtAssetId;
    private BigDecimal principal;
    private BigDecimal accruedInterest;
    private BigDecimal debt;
    private BigDecimal interestRateAtOrigination;
    private BigDecimal originationBalance;
    private LoanStatus status;
    private Instant openedAt;
    private Instant lastUpdateTimestamp;

    public static LoanView from(Loan l) {
        return LoanView.builder()
                .loanId(l.getLoanId())
                .borrowerId(l.getBorrowerId())
                .holderId(l.getHolderId())
                .collateralAssetId(l.getCollateralAssetId())
                .collateralAmount(l.getCollateralAmount())
                .debtAssetId(l.getDebtAssetId())
                .principal(l.getPrincipal())
                .accruedInterest(l.getAccruedInterest())
                .debt(l.debt())
                .interestRateAtOrigination(l.getInterestRateAtOrigination())
                .originationBalance(l.getOriginationBalance())
                .status(l.getStatus())
                .openedAt(l.getOpenedAt())
                .lastUpdateTimestamp(l.getLastUpdateTimestamp())
                .build();
    }
}
