package com.lendrisk.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Opens a loan: {@code collateralAmount} of the user's free collateral is locked,
 * {@code amount} of the debt asset is lent.
 */
@Data
public class BorrowRequest {
    @NotBlank
    private String userId;
    @NotBlank
    private String debtAssetId;
    @NotBlank
    private String collateralAssetId;

    @NotNull
    @Positive
    private BigDecimal collateralAmount;

    @NotNull
    @Positive
    private BigDecimal amount;
}
