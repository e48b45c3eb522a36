package com.lendrisk.model;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import com.lendrisk.util.Amounts;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Permanent, non-transferable per-user record: balances, loans and credit score.
 * The owner account is fixed at registration. Balances and score change only through protocol operations.
 */
@Getter
public class CreditRecord {

    private final String userId;
    private final String accountAddress;
    private final Instant registeredAt;

    // Sorted so audits iterate assets deterministically.
    private final Map<String, BigDecimal> deposits;
    /** Free collateral; amounts locked in loans live on the loans. */
    private final Map<String, BigDecimal> collateral;
    private final Set<String> loanIds;
    private final List<RepaymentEvent> repaymentHistory;

    private int creditScore;
    private int paidOff;
    private int defaults;

    public CreditRecord(String userId, String accountAddress, Instant registeredAt) {
        this(userId, accountAddress, registeredAt, new TreeMap<>(), new TreeMap<>(), new LinkedHashSet<>(),
                new ArrayList<>(), 0, 0, 0);
    }

    private CreditRecord(String userId, String accountAddress, Instant registeredAt,
                         Map<String, BigDecimal> deposits, Map<String, BigDecimal> collateral,
                         Set<String> loanIds, List<RepaymentEvent> repaymentHistory,
                         int creditScore, int paidOff, int defaults) {
        this.userId = userId;
        this.accountAddress = accountAddress;
        this.registeredAt = registeredAt;
        this.deposits = deposits;
        this.collateral = collateral;
        this.loanIds = loanIds;
        this.repaymentHistory = repaymentHistory;
        this.creditScore = creditScore;
        this.paidOff = paidOff;
        this.defaults = defaults;
    }

    public CreditRecord copy() {
        return new CreditRecord(userId, accountAddress, registeredAt,
                new TreeMap<>(deposits), new TreeMap<>(collateral), new LinkedHashSet<>(loanIds),
                new ArrayList<>(repaymentHistory), creditScore, paidOff, defaults);
    }

    public Map<String, BigDecimal> getDeposits() { return Collections.unmodifiableMap(deposits); }
    public Map<String, BigDecimal> getCollateral() { return Collections.unmodifiableMap(collateral); }
    public Set<String> getLoanIds() { return Collections.unmodifiableSet(loanIds); }
    public List<RepaymentEvent> getRepaymentHistory() { return Collections.unmodifiableList(repaymentHistory); }

    public BigDecimal depositOf(String assetId) {
        return deposits.getOrDefault(assetId, Amounts.ZERO);
    }

    public BigDecimal collateralOf(String assetId) {
        return collateral.getOrDefault(assetId, Amounts.ZERO);
    }

    // ---------- balance mutations ----------

    public void addDeposit(String assetId, BigDecimal amount) {
        deposits.merge(assetId, amount, BigDecimal::add);
    }

    public void removeDeposit(String assetId, BigDecimal amount) {
        deposits.put(assetId, debit(depositOf(assetId), amount, "deposit", assetId));
    }

    public void addCollateral(String assetId, BigDecimal amount) {
        collateral.merge(assetId, amount, BigDecimal::add);
    }

    public void removeCollateral(String assetId, BigDecimal amount) {
        collateral.put(assetId, debit(collateralOf(assetId), amount, "free collateral", assetId));
    }

    public void addLoan(String loanId) {
        loanIds.add(loanId);
    }

    // ---------- credit history ----------

    /** Raises the score by {@code points}, never past {@code ceiling}. The score cannot go down. */
    public int raiseScore(int points, int ceiling) {
        if (points <= 0) return 0;
        int next = Math.min(ceiling, creditScore + points);
        int gained = Math.max(0, next - creditScore);
        creditScore += gained;
        return gained;
    }

    public void recordRepayment(RepaymentEvent event) {
        repaymentHistory.add(event);
    }

    public void incrementPaidOff() {
        paidOff++;
    }

    public void incrementDefaults() {
        defaults++;
    }

    private BigDecimal debit(BigDecimal balance, BigDecimal amount, String label, String assetId) {
        if (amount.compareTo(balance) > 0) {
            throw new LendingException(ErrorCode.INSUFFICIENT_BALANCE,
                    "User " + userId + " has " + balance.stripTrailingZeros().toPlainString() + " " + label
                            + " of " + assetId + ", requested " + amount.stripTrailingZeros().toPlainString());
        }
        return balance.subtract(amount);
    }
}
