package com.lendrisk.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Transfer instruction accepted by the custody ledger. One document per instruction;
 * all instructions of one protocol operation share an operationId.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document("transfer_records")
@CompoundIndexes({
        @CompoundIndex(name = "by_asset_ts", def = "{'assetId':1,'ts':1}")
})
public class TransferRecordDocument {

    @Id
    private String id;

    @Indexed
    private String operationId;

    /** deposit, withdraw, borrow, repay, liquidate, ... */
    private String operation;

    private String assetId;
    private BigDecimal amount;

    /** Ledger accounts, e.g. "user:&lt;id&gt;", "pool:&lt;asset&gt;", "collateral:&lt;asset&gt;". */
    private String from;
    private String to;

    private Instant ts;
}
