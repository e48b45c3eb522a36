package com.lendrisk.service;

import com.lendrisk.exception.LendingException;
import com.lendrisk.model.CreditRecord;
import com.lendrisk.model.Loan;
import com.lendrisk.model.Pool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Published protocol state: pools, credit records and loans.
 *
 * <p>A published object is never mutated again. Operations work on copies and replace the published
 * objects in {@link #publish} once custody has accepted the transfers, so readers always see either
 * the old or the new version of an entity.
 */
public class ProtocolStore {

    private final Map<String, Pool> pools = new ConcurrentHashMap<>();
    private final Map<String, CreditRecord> users = new ConcurrentHashMap<>();
    private final Map<String, Loan> loans = new ConcurrentHashMap<>();
    /** Normalized account address -> userId. */
    private final Map<String, String> accounts = new ConcurrentHashMap<>();
    private final EntityLocks locks;

    public ProtocolStore(Duration lockTimeout) {
        this.locks = new EntityLocks(lockTimeout);
    }

    public static String poolKey(String assetId) { return "pool:" + assetId; }
    public static String userKey(String userId) { return "user:" + userId; }
    public static String loanKey(String loanId) { return "loan:" + loanId; }
    public static String accountKey(String account) { return "account:" + account; }

    public <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        return locks.withLocks(keys, action);
    }

    /** Start-up registration; pools are never removed. */
    public void addPool(Pool pool) {
        if (pools.putIfAbsent(pool.getAssetId(), pool) != null) {
            throw new IllegalStateException("Pool already exists: " + pool.getAssetId());
        }
    }

    public Pool requirePool(String assetId) {
        Pool p = assetId == null ? null : pools.get(assetId);
        if (p == null) throw LendingException.unknownAsset(assetId);
        return p;
    }

    public CreditRecord requireUser(String userId) {
        CreditRecord r = userId == null ? null : users.get(userId);
        if (r == null) throw LendingException.unknownUser(userId);
        return r;
    }

    public Loan requireLoan(String loanId) {
        Loan l = loanId == null ? null : loans.get(loanId);
        if (l == null) throw LendingException.unknownLoan(loanId);
        return l;
    }

    public Optional<String> userForAccount(String account) {
        return Optional.ofNullable(accounts.get(account));
    }

    public List<Pool> pools() {
        return new ArrayList<>(pools.values());
    }

    public List<String> loanIds() {
        return new ArrayList<>(loans.keySet());
    }

    void publish(Collection<Pool> stagedPools, Collection<CreditRecord> stagedUsers, Collection<Loan> stagedLoans) {
        stagedPools.forEach(p -> pools.put(p.getAssetId(), p));
        stagedUsers.forEach(u -> {
            users.put(u.getUserId(), u);
            accounts.putIfAbsent(u.getAccountAddress(), u.getUserId());
        });
        stagedLoans.forEach(l -> loans.put(l.getLoanId(), l));
    }
}
