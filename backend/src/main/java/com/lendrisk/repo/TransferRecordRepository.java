package com.lendrisk.repo;

import com.lendrisk.model.TransferRecordDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface TransferRecordRepository extends MongoRepository<TransferRecordDocument, String> {

    List<TransferRecordDocument> findByAssetIdAndTsBetweenOrderByTsAsc(String assetId, Instant from, Instant to);

    /** All instructions committed by one protocol operation. */
    List<TransferRecordDocument> findByOperationId(String operationId);
}
