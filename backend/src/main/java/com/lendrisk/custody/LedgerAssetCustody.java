package com.lendrisk.custody;

import com.lendrisk.model.TransferRecordDocument;
import com.lendrisk.repo.TransferRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Custody adapter that records each operation's transfer batch in MongoDB with a single saveAll.
 * Settlement against real token balances happens downstream of this ledger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerAssetCustody implements AssetCustody {

    private final TransferRecordRepository repo;
    private final Clock clock;

    @Override
    public void execute(String operationId, String operation, List<TransferInstruction> instructions) {
        if (instructions.isEmpty()) return;
        Instant ts = clock.instant();
        List<TransferRecordDocument> batch = instructions.stream()
                .map(t -> TransferRecordDocument.builder()
                        .operationId(operationId)
                        .operation(operation)
                        .assetId(t.assetId())
                        .amount(t.amount())
                        .from(t.from())
                        .to(t.to())
                        .ts(ts)
                        .build())
                .toList();
        repo.saveAll(batch);
        log.debug("[custody] op={} {} recorded {} transfer(s)", operationId, operation, batch.size());
    }
}
