package com.lendrisk.api;

import com.lendrisk.model.PoolSnapshot;
import com.lendrisk.repo.PoolSnapshotRepo;
import com.lendrisk.service.PoolSnapshotService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Pool snapshots (time series).
 */
@RestController
@RequestMapping("/api/v1/pool-snapshots")
@RequiredArgsConstructor
public class PoolSnapshotController {

    private final PoolSnapshotRepo repo;
    private final PoolSnapshotService snapshotService;

    /**
     * Latest snapshot for one asset.
     */
    @GetMapping("/latest")
    public PoolSnapshot latest(@RequestParam String assetId) {
        return repo.findTopByAssetIdOrderByTsDesc(assetId);
    }

    /**
     * Time range for one asset (inclusive). ISO-8601 instants.
     */
    @GetMapping
    public List<PoolSnapshot> range(
            @RequestParam String assetId,
            @RequestParam Instant from,
            @RequestParam Instant to
    ) {
        return repo.findByAssetIdAndTsBetweenOrderByTsAsc(assetId, from, to);
    }

    @PostMapping("/capture")
    public List<PoolSnapshot> capture() {
        return snapshotService.captureAll();
    }
}
