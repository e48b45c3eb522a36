package com.lendrisk.api.dto;

import com.lendrisk.risk.HealthFactor;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * JSON has no infinity: a debt-free loan is reported with {@code infinite = true} and a null value.
 */
@Data
@Builder
public class HealthFactorView {
    private String loanId;
    private BigDecimal healthFactor;
    private boolean infinite;
    private boolean liquidatable;

    public static HealthFactorView of(String loanId, HealthFactor hf) {
        return HealthFactorView.builder()
                .loanId(loanId)
                .healthFactor(hf.isInfinite() ? null : hf.value())
                .infinite(hf.isInfinite())
                .liquidatable(hf.isAtOrBelow(BigDecimal.ONE))
                .build();
    }
}
