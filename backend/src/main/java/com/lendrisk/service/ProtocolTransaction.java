package com.lendrisk.service;

import com.lendrisk.custody.AssetCustody;
import com.lendrisk.custody.TransferInstruction;
import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import com.lendrisk.model.CreditRecord;
import com.lendrisk.model.Loan;
import com.lendrisk.model.Pool;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working set of one protocol operation. Hands out private copies of the entities the operation
 * touches, collects the transfers it needs and publishes everything in {@link #commit}.
 * Dropping the transaction without committing leaves the store untouched.
 */
class ProtocolTransaction {

    private final ProtocolStore store;
    @Getter
    private final String operationId;
    @Getter
    private final Instant now;

    private final Map<String, Pool> pools = new LinkedHashMap<>();
    private final Map<String, CreditRecord> users = new LinkedHashMap<>();
    private final Map<String, Loan> loans = new LinkedHashMap<>();
    private final List<TransferInstruction> transfers = new ArrayList<>();
    private final List<Runnable> afterCommit = new ArrayList<>();

    ProtocolTransaction(ProtocolStore store, String operationId, Instant now) {
        this.store = store;
        this.operationId = operationId;
        this.now = now;
    }

    Pool pool(String assetId) {
        return pools.computeIfAbsent(assetId, id -> store.requirePool(id).copy());
    }

    CreditRecord user(String userId) {
        return users.computeIfAbsent(userId, id -> store.requireUser(id).copy());
    }

    Loan loan(String loanId) {
        return loans.computeIfAbsent(loanId, id -> store.requireLoan(id).copy());
    }

    void createUser(CreditRecord record) {
        users.put(record.getUserId(), record);
    }

    void createLoan(Loan loan) {
        loans.put(loan.getLoanId(), loan);
    }

    void transfer(String assetId, BigDecimal amount, String from, String to) {
        if (amount.signum() > 0) transfers.add(new TransferInstruction(assetId, amount, from, to));
    }

    /** Runs once the operation is published; skipped when it is rejected. */
    void afterCommit(Runnable action) {
        afterCommit.add(action);
    }

    List<TransferInstruction> transfers() {
        return List.copyOf(transfers);
    }

    /** Runs the custody batch and, only if it succeeds, publishes the staged entities. */
    void commit(AssetCustody custody, String operation) {
        try {
            custody.execute(operationId, operation, transfers());
        } catch (LendingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LendingException(ErrorCode.CUSTODY_FAILURE,
                    "Custody rejected " + operation + " (" + operationId + "): " + e.getMessage(), e);
        }
        store.publish(pools.values(), users.values(), loans.values());
        afterCommit.forEach(Runnable::run);
    }
}
