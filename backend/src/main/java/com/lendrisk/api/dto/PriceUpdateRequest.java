package com.lendrisk.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class PriceUpdateRequest {
    @NotNull
    @Positive
    private BigDecimal price;
}
