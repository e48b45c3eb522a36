package com.lendrisk.repo;

import com.lendrisk.model.PoolSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface PoolSnapshotRepo extends MongoRepository<PoolSnapshot, String> {
    List<PoolSnapshot> findByAssetIdAndTsBetweenOrderByTsAsc(String assetId, Instant from, Instant to);

    PoolSnapshot findTopByAssetIdOrderByTsDesc(String assetId);
}
