package com.lendrisk.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time copy of one pool's aggregates and rates, captured on demand.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("pool_snapshots")
public class PoolSnapshot {

    @Id
    private String id;

    @Indexed
    private String assetId;

    /** UTC timestamp of the capture batch; all pools of one capture share it. */
    @Indexed
    private Instant ts;

    private BigDecimal totalSupply;
    private BigDecimal totalBorrowed;
    private BigDecimal reserves;
    private BigDecimal totalCollateral;

    /** Rates in percent APR, utilization in percent. */
    private double utilizationPct;
    private double borrowApyPct;
    private double supplyApyPct;

    private BigDecimal liquidityIndex;
    private BigDecimal borrowIndex;
}
