package com.lendrisk.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Supply/collateral movement of one user in one pool. The asset comes from the path.
 */
@Data
public class BalanceRequest {
    @NotBlank
    private String userId;

    @NotNull
    @Positive
    private BigDecimal amount;
}
