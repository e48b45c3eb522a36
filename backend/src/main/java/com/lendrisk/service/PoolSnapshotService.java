package com.lendrisk.service;

import com.lendrisk.model.Pool;
import com.lendrisk.model.PoolSnapshot;
import com.lendrisk.repo.PoolSnapshotRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Captures the current state of every pool into MongoDB. Runs only when asked; there is no scheduler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolSnapshotService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LendingProtocolService protocol;
    private final PoolSnapshotRepo snapshotRepo;
    private final Clock clock;

    /** One snapshot per pool, all stamped with the same timestamp. */
    public List<PoolSnapshot> captureAll() {
        Instant ts = clock.instant();
        List<PoolSnapshot> batch = protocol.getPools().stream()
                .map(p -> toSnapshot(p, ts))
                .toList();
        if (!batch.isEmpty()) snapshotRepo.saveAll(batch);
        log.info("[pool-snapshot] captured {} pool(s) at {}", batch.size(), ts);
        return batch;
    }

    static PoolSnapshot toSnapshot(Pool p, Instant ts) {
        return PoolSnapshot.builder()
                .assetId(p.getAssetId())
                .ts(ts)
                .totalSupply(p.getTotalSupply())
                .totalBorrowed(p.getTotalBorrowed())
                .reserves(p.getReserves())
                .totalCollateral(p.getTotalCollateral())
                .utilizationPct(pct(p.utilizationRate()))
                .borrowApyPct(pct(p.borrowRate()))
                .supplyApyPct(pct(p.supplyRate()))
                .liquidityIndex(p.getLiquidityIndex())
                .borrowIndex(p.getBorrowIndex())
                .build();
    }

    private static double pct(BigDecimal fraction) {
        return fraction.multiply(HUNDRED).doubleValue();
    }
}
