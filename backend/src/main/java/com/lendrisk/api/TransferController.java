package com.lendrisk.api;

import com.lendrisk.model.TransferRecordDocument;
import com.lendrisk.repo.TransferRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the transfer instructions accepted by the custody ledger.
 */
@RestController
@RequestMapping("/api/v1/transfers")
@RequiredArgsConstructor
public class TransferController {

    private final TransferRecordRepository repo;

    @GetMapping
    public List<TransferRecordDocument> range(
            @RequestParam String assetId,
            @RequestParam Instant from,
            @RequestParam Instant to
    ) {
        return repo.findByAssetIdAndTsBetweenOrderByTsAsc(assetId, from, to);
    }

    @GetMapping("/operation/{operationId}")
    public List<TransferRecordDocument> byOperation(@PathVariable String operationId) {
        return repo.findByOperationId(operationId);
    }
}
