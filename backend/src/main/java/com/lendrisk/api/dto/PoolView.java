package com.lendrisk.api.dto;

import com.lendrisk.model.Pool;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Pool aggregates with rates as annual fractions (0.05 = 5% APR).
 */
@Data
@Builder
public class PoolView {
    private String assetId;
    private BigDecimal totalSupply;
    private BigDecimal totalBorrowed;
    private BigDecimal availableLiquidity;
    private BigDecimal reserves;
    private BigDecimal totalCollateral;
    private BigDecimal reserveFactor;

    private BigDecimal utilization;
    private BigDecimal borrowRate;
    private BigDecimal supplyRate;

    private BigDecimal liquidityIndex;
    private BigDecimal borrowIndex;
    private Instant lastUpdateTimestamp;

    public static PoolView from(Pool p) {
        return PoolView.builder()
                .assetId(p.getAssetId())
                .totalSupply(p.getTotalSupply())
                .totalBorrowed(p.getTotalBorrowed())
                .availableLiquidity(p.availableLiquidity())
                .reserves(p.getReserves())
                .totalCollateral(p.getTotalCollateral())
                .reserveFactor(p.getReserveFactor())
                .utilization(p.utilizationRate())
                .borrowRate(p.borrowRate())
                .supplyRate(p.supplyRate())
                .liquidityIndex(p.getLiquidityIndex())
                .borrowIndex(p.getBorrowIndex())
                .lastUpdateTimestamp(p.getLastUpdateTimestamp())
                .build();
    }
}
