package com.lendrisk.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class LiquidateRequest {
    @NotBlank
    private String liquidatorId;

    /** Debt-asset amount the liquidator repays. */
    @NotNull
    @Positive
    private BigDecimal repayAmount;
}
