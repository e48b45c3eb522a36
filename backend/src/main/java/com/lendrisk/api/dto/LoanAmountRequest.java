package com.lendrisk.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/** Borrow more, repay or add collateral on an existing loan, as its current holder. */
@Data
public class LoanAmountRequest {
    @NotBlank
    private String holderId;

    @NotNull
    @Positive
    private BigDecimal amount;
}
