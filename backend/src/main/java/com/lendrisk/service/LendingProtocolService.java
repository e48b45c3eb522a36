package com.lendrisk.service;

import com.lendrisk.credit.CreditScorer;
import com.lendrisk.custody.AssetCustody;
import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import com.lendrisk.liquidation.LiquidationEngine;
import com.lendrisk.liquidation.LiquidationResult;
import com.lendrisk.model.CreditRecord;
import com.lendrisk.model.Loan;
import com.lendrisk.model.LoanStatus;
import com.lendrisk.model.Pool;
import com.lendrisk.model.RepaymentSource;
import com.lendrisk.price.PriceFeed;
import com.lendrisk.risk.HealthFactor;
import com.lendrisk.risk.RiskEngine;
import com.lendrisk.util.AddressUtil;
import com.lendrisk.util.Amounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Stream;

import static com.lendrisk.custody.TransferInstruction.collateralAccount;
import static com.lendrisk.custody.TransferInstruction.poolAccount;
import static com.lendrisk.custody.TransferInstruction.userAccount;
import static com.lendrisk.service.ProtocolStore.accountKey;
import static com.lendrisk.service.ProtocolStore.loanKey;
import static com.lendrisk.service.ProtocolStore.poolKey;
import static com.lendrisk.service.ProtocolStore.userKey;

/**
 * Operation handlers of the lending core.
 *
 * Every operation:
 * 1) validates its arguments and resolves the entities it touches,
 * 2) locks those entities (sorted, bounded wait),
 * 3) accrues interest and applies checks and mutations to private copies,
 * 4) hands the transfers to custody and publishes the copies only if custody accepts them.
 *
 * A rejection at any step leaves no trace in the published state.
 */
@Service
@Slf4j
public class LendingProtocolService {

    private final ProtocolStore store;
    private final RiskEngine risk;
    private final LiquidationEngine liquidationEngine;
    private final CreditScorer scorer;
    private final PriceFeed prices;
    private final AssetCustody custody;
    private final Clock clock;
    private final InterestAccrual accrual;

    public LendingProtocolService(ProtocolStore store, RiskEngine risk, LiquidationEngine liquidationEngine,
                                  CreditScorer scorer, PriceFeed prices, AssetCustody custody, Clock clock) {
        this.store = store;
        this.risk = risk;
        this.liquidationEngine = liquidationEngine;
        this.scorer = scorer;
        this.prices = prices;
        this.custody = custody;
        this.clock = clock;
        this.accrual = new InterestAccrual(risk);
    }

    // =====================================================================
    // Identity
    // =====================================================================

    /** Creates the permanent credit record of a wallet account. One record per account. */
    public String registerUser(String accountAddress) {
        String account = AddressUtil.normalize(accountAddress);
        return execute("register", Set.of(accountKey(account)), tx -> {
            store.userForAccount(account).ifPresent(existing -> {
                throw new LendingException(ErrorCode.DUPLICATE_ACCOUNT,
                        "Account " + account + " already holds credit record " + existing);
            });
            String userId = UUID.randomUUID().toString();
            tx.createUser(new CreditRecord(userId, account, tx.getNow()));
            tx.afterCommit(() -> log.info("[lending] register user={} account={}", userId, account));
            return userId;
        });
    }

    // =====================================================================
    // Supply side
    // =====================================================================

    public void deposit(String userId, String assetId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "deposit amount");
        resolve(assetId, userId);
        execute("deposit", Set.of(poolKey(assetId), userKey(userId)), tx -> {
            Pool pool = tx.pool(assetId);
            CreditRecord user = tx.user(userId);
            pool.deposit(value, tx.getNow());
            user.addDeposit(assetId, value);
            tx.transfer(assetId, value, userAccount(userId), poolAccount(assetId));
            tx.afterCommit(() -> log.info("[lending] deposit user={} asset={} amount={}", userId, assetId, plain(value)));
            return null;
        });
    }

    public void withdraw(String userId, String assetId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "withdraw amount");
        resolve(assetId, userId);
        execute("withdraw", Set.of(poolKey(assetId), userKey(userId)), tx -> {
            Pool pool = tx.pool(assetId);
            CreditRecord user = tx.user(userId);
            requireNoLien(user, assetId);
            user.removeDeposit(assetId, value);
            pool.withdraw(value, tx.getNow());
            tx.transfer(assetId, value, poolAccount(assetId), userAccount(userId));
            tx.afterCommit(() -> log.info("[lending] withdraw user={} asset={} amount={}", userId, assetId, plain(value)));
            return null;
        });
    }

    public void depositCollateral(String userId, String assetId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "collateral amount");
        resolve(assetId, userId);
        execute("deposit-collateral", Set.of(poolKey(assetId), userKey(userId)), tx -> {
            tx.pool(assetId).addCollateral(value);
            tx.user(userId).addCollateral(assetId, value);
            tx.transfer(assetId, value, userAccount(userId), collateralAccount(assetId));
            tx.afterCommit(() -> log.info("[lending] deposit-collateral user={} asset={} amount={}", userId, assetId, plain(value)));
            return null;
        });
    }

    /** Withdraws free collateral; collateral locked in loans is not available here. */
    public void withdrawCollateral(String userId, String assetId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "collateral amount");
        resolve(assetId, userId);
        execute("withdraw-collateral", Set.of(poolKey(assetId), userKey(userId)), tx -> {
            tx.user(userId).removeCollateral(assetId, value);
            tx.pool(assetId).removeCollateral(value);
            tx.transfer(assetId, value, collateralAccount(assetId), userAccount(userId));
            tx.afterCommit(() -> log.info("[lending] withdraw-collateral user={} asset={} amount={}", userId, assetId, plain(value)));
            return null;
        });
    }

    /** Moves part of a user's supply into free collateral of the same asset. */
    public void convertToCollateral(String userId, String assetId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "convert amount");
        resolve(assetId, userId);
        execute("convert-to-collateral", Set.of(poolKey(assetId), userKey(userId)), tx -> {
            Pool pool = tx.pool(assetId);
            CreditRecord user = tx.user(userId);
            requireNoLien(user, assetId);
            user.removeDeposit(assetId, value);
            pool.withdraw(value, tx.getNow());
            pool.addCollateral(value);
            user.addCollateral(assetId, value);
            tx.transfer(assetId, value, poolAccount(assetId), collateralAccount(assetId));
            tx.afterCommit(() -> log.info("[lending] convert-to-collateral user={} asset={} amount={}", userId, assetId, plain(value)));
            return null;
        });
    }

    /** Moves free collateral back into the lending supply of the same asset. */
    public void convertToDeposit(String userId, String assetId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "convert amount");
        resolve(assetId, userId);
        execute("convert-to-deposit", Set.of(poolKey(assetId), userKey(userId)), tx -> {
            Pool pool = tx.pool(assetId);
            CreditRecord user = tx.user(userId);
            user.removeCollateral(assetId, value);
            pool.removeCollateral(value);
            pool.deposit(value, tx.getNow());
            user.addDeposit(assetId, value);
            tx.transfer(assetId, value, collateralAccount(assetId), poolAccount(assetId));
            tx.afterCommit(() -> log.info("[lending] convert-to-deposit user={} asset={} amount={}", userId, assetId, plain(value)));
            return null;
        });
    }

    // =====================================================================
    // Borrow side
    // =====================================================================

    /**
     * Opens a loan: locks {@code collateralAmount} of the user's free collateral and lends {@code amount}
     * of the debt asset, at the pool's current rate less the user's credit discount.
     */
    public String borrow(String userId, String debtAssetId, String collateralAssetId,
                         BigDecimal collateralAmount, BigDecimal amount) {
        BigDecimal collateral = Amounts.requirePositive(collateralAmount, "collateral amount");
        BigDecimal value = Amounts.requirePositive(amount, "borrow amount");
        resolve(debtAssetId, userId);
        store.requirePool(collateralAssetId);

        // debt and collateral may be the same asset
        Set<String> keys = new LinkedHashSet<>(List.of(poolKey(debtAssetId), poolKey(collateralAssetId), userKey(userId)));
        return execute("borrow", keys, tx -> {
            Pool debtPool = tx.pool(debtAssetId);
            CreditRecord user = tx.user(userId);
            Instant now = tx.getNow();
            debtPool.accrueIndices(now);

            user.removeCollateral(collateralAssetId, collateral);
            risk.checkBorrow(collateral, collateralAssetId, value, debtAssetId, prices, user.getCreditScore());
            BigDecimal rate = risk.borrowRateFor(debtPool, user.getCreditScore());
            debtPool.borrow(value, now);

            String loanId = UUID.randomUUID().toString();
            tx.createLoan(Loan.open(loanId, userId, collateralAssetId, collateral, debtAssetId, value, rate, now));
            user.addLoan(loanId);
            tx.transfer(debtAssetId, value, poolAccount(debtAssetId), userAccount(userId));
            tx.afterCommit(() -> log.info("[lending] borrow user={} loan={} asset={} amount={} collateral={} {} rate={}",
                    userId, loanId, debtAssetId, plain(value), plain(collateral), collateralAssetId, plain(rate)));
            return loanId;
        });
    }

    /** Adds principal to an active loan, gated by the same max-borrow rule as a new loan. */
    public void borrowAdditional(String loanId, String holderId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "borrow amount");
        Loan current = store.requireLoan(loanId);
        store.requireUser(holderId);

        executeOnLoan("borrow-additional", current, holderId, tx -> {
            Loan loan = requireHeldActive(tx.loan(loanId), holderId);
            Pool debtPool = tx.pool(loan.getDebtAssetId());
            CreditRecord borrower = tx.user(loan.getBorrowerId());
            accrual.accrue(loan, debtPool, borrower.getCreditScore(), tx.getNow());

            risk.checkBorrow(loan.getCollateralAmount(), loan.getCollateralAssetId(),
                    loan.debt().add(value), loan.getDebtAssetId(), prices, borrower.getCreditScore());
            debtPool.borrow(value, tx.getNow());
            loan.increasePrincipal(value);
            tx.transfer(loan.getDebtAssetId(), value, poolAccount(loan.getDebtAssetId()), userAccount(holderId));
            tx.afterCommit(() -> log.info("[lending] borrow-additional holder={} loan={} amount={} debt={}",
                    holderId, loanId, plain(value), plain(loan.debt())));
            return null;
        });
    }

    /** Moves free collateral of the holder into an active loan. */
    public void addCollateral(String loanId, String holderId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "collateral amount");
        Loan current = store.requireLoan(loanId);
        store.requireUser(holderId);

        executeOnLoan("add-collateral", current, holderId, tx -> {
            Loan loan = requireHeldActive(tx.loan(loanId), holderId);
            CreditRecord borrower = tx.user(loan.getBorrowerId());
            accrual.accrue(loan, tx.pool(loan.getDebtAssetId()), borrower.getCreditScore(), tx.getNow());

            tx.user(holderId).removeCollateral(loan.getCollateralAssetId(), value);
            loan.addCollateral(value);
            reopenIfHealthy(loan, borrower);
            tx.afterCommit(() -> log.info("[lending] add-collateral holder={} loan={} amount={} collateral={}",
                    holderId, loanId, plain(value), plain(loan.getCollateralAmount())));
            return null;
        });
    }

    /**
     * Repays interest first, then principal. Over-payment is clipped to the debt. A loan repaid in full
     * closes and its collateral becomes free collateral of the holder.
     *
     * @return amount actually applied
     */
    public BigDecimal repay(String loanId, String holderId, BigDecimal amount) {
        BigDecimal value = Amounts.requirePositive(amount, "repay amount");
        Loan current = store.requireLoan(loanId);
        store.requireUser(holderId);

        return executeOnLoan("repay", current, holderId, tx -> {
            Loan loan = requireHeldActive(tx.loan(loanId), holderId);
            Pool debtPool = tx.pool(loan.getDebtAssetId());
            CreditRecord borrower = tx.user(loan.getBorrowerId());
            Instant now = tx.getNow();
            accrual.accrue(loan, debtPool, borrower.getCreditScore(), now);

            BigDecimal applied = loan.applyRepayment(value);
            debtPool.repay(applied, now);
            int gained = scorer.onRepayment(borrower, loan, applied, RepaymentSource.BORROWER, now);

            if (loan.debt().signum() == 0) {
                BigDecimal released = loan.getCollateralAmount();
                loan.removeCollateral(released);
                tx.user(holderId).addCollateral(loan.getCollateralAssetId(), released);
                loan.transitionTo(LoanStatus.CLOSED);
                borrower.incrementPaidOff();
            } else {
                reopenIfHealthy(loan, borrower);
            }
            tx.transfer(loan.getDebtAssetId(), applied, userAccount(holderId), poolAccount(loan.getDebtAssetId()));
            tx.afterCommit(() -> log.info("[lending] repay holder={} loan={} applied={} remaining={} status={} score+{}",
                    holderId, loanId, plain(applied), plain(loan.debt()), loan.getStatus(), gained));
            return applied;
        });
    }

    /**
     * Repays part of an unhealthy loan on the borrower's behalf and seizes collateral plus the liquidation bonus.
     */
    public LiquidationResult liquidate(String loanId, String liquidatorId, BigDecimal repayAmount) {
        BigDecimal value = Amounts.requirePositive(repayAmount, "repay amount");
        Loan current = store.requireLoan(loanId);
        store.requireUser(liquidatorId);

        Set<String> keys = loanLockKeys(current, liquidatorId);
        return execute("liquidate", keys, tx -> {
            Loan loan = tx.loan(loanId);
            Pool debtPool = tx.pool(loan.getDebtAssetId());
            Pool collateralPool = tx.pool(loan.getCollateralAssetId());
            if (!loan.getHolderId().equals(current.getHolderId())) {
                throw new LendingException(ErrorCode.RESOURCE_BUSY, "Loan " + loanId + " changed holder, retry");
            }
            CreditRecord borrower = tx.user(loan.getBorrowerId());
            CreditRecord holder = tx.user(loan.getHolderId());
            Instant now = tx.getNow();
            accrual.accrue(loan, debtPool, borrower.getCreditScore(), now);

            LiquidationResult result = liquidationEngine.liquidate(
                    loan, debtPool, collateralPool, borrower, holder, liquidatorId, value, prices, now);

            tx.transfer(loan.getDebtAssetId(), result.getRepaid(),
                    userAccount(liquidatorId), poolAccount(loan.getDebtAssetId()));
            tx.transfer(loan.getCollateralAssetId(), result.getCollateralSeized(),
                    collateralAccount(loan.getCollateralAssetId()), userAccount(liquidatorId));

            if (result.isSeizureShortfall()) {
                tx.afterCommit(() -> log.warn("[lending] bad debt: loan={} collateral exhausted, shortfall={} {} (repaid={})",
                        loanId, plain(result.getShortfall()), loan.getCollateralAssetId(), plain(result.getRepaid())));
            }
            tx.afterCommit(() -> log.info("[lending] liquidate liquidator={} loan={} repaid={} seized={} hf {} -> {} status={}",
                    liquidatorId, loanId, plain(result.getRepaid()), plain(result.getCollateralSeized()),
                    result.getHealthBefore(), result.getHealthAfter(), result.getStatus()));
            return result;
        });
    }

    /** Hands the loan document to another registered user. Credit effects stay with the borrower. */
    public void reassignHolder(String loanId, String currentHolderId, String newHolderId) {
        Loan current = store.requireLoan(loanId);
        store.requireUser(newHolderId);

        executeOnLoan("reassign-holder", current, currentHolderId, tx -> {
            Loan loan = tx.loan(loanId);
            requireHolder(loan, currentHolderId);
            loan.reassignHolder(newHolderId);
            tx.afterCommit(() -> log.info("[lending] reassign-holder loan={} {} -> {}", loanId, currentHolderId, newHolderId));
            return null;
        });
    }

    // =====================================================================
    // Queries (no side effects)
    // =====================================================================

    public BigDecimal getLiquidity(String assetId) {
        return readPool(assetId).availableLiquidity();
    }

    public BigDecimal getTotalSupply(String assetId) {
        return readPool(assetId).getTotalSupply();
    }

    public BigDecimal getTotalBorrowed(String assetId) {
        return readPool(assetId).getTotalBorrowed();
    }

    public BigDecimal getUtilization(String assetId) {
        return readPool(assetId).utilizationRate();
    }

    /** Pool with its indices projected to now. */
    public Pool getPool(String assetId) {
        return readPool(assetId);
    }

    public List<Pool> getPools() {
        return store.pools().stream()
                .map(p -> readPool(p.getAssetId()))
                .sorted(Comparator.comparing(Pool::getAssetId))
                .toList();
    }

    public CreditRecord getCreditRecord(String userId) {
        store.requireUser(userId);
        return store.withLocks(Set.of(userKey(userId)), () -> store.requireUser(userId).copy());
    }

    /** Loan with interest projected to now. */
    public Loan getLoan(String loanId) {
        return projectLoan(loanId, (loan, debtPool, score) -> loan);
    }

    public HealthFactor getHealthFactor(String loanId) {
        return projectLoan(loanId, (loan, debtPool, score) -> risk.healthFactor(loan, prices, score));
    }

    /** Further principal the loan could take now: the max-borrow headroom, bounded by pool liquidity. */
    public BigDecimal getMaxBorrow(String loanId) {
        return projectLoan(loanId, (loan, debtPool, score) -> {
            if (!loan.isActive()) return Amounts.ZERO;
            BigDecimal headroom = risk.maxAdditionalBorrow(loan.getCollateralAmount(), loan.getCollateralAssetId(),
                    loan.debt(), loan.getDebtAssetId(), prices, score);
            return Amounts.min(headroom, Amounts.max(Amounts.ZERO, debtPool.availableLiquidity()));
        });
    }

    /**
     * Active loans whose current health factor is at or below 1. The stream is lazy: each loan is
     * evaluated when pulled, against state and prices at that moment. Every call starts a fresh pass.
     */
    public Stream<String> findBadLoans() {
        return store.loanIds().stream()
                .sorted()
                .filter(this::isBad);
    }

    public BigDecimal getPrice(String assetId) {
        return prices.getPrice(assetId);
    }

    // =====================================================================
    // internals
    // =====================================================================

    private boolean isBad(String loanId) {
        return projectLoan(loanId, (loan, debtPool, score) ->
                loan.isActive() && risk.isLiquidatable(risk.healthFactor(loan, prices, score)));
    }

    @FunctionalInterface
    private interface LoanProjection<T> {
        T apply(Loan loan, Pool debtPool, int borrowerScore);
    }

    private <T> T projectLoan(String loanId, LoanProjection<T> projection) {
        Loan current = store.requireLoan(loanId);
        Set<String> keys = Set.of(loanKey(loanId), userKey(current.getBorrowerId()), poolKey(current.getDebtAssetId()));
        return store.withLocks(keys, () -> {
            Loan loan = store.requireLoan(loanId).copy();
            Pool debtPool = store.requirePool(loan.getDebtAssetId()).copy();
            int score = store.requireUser(loan.getBorrowerId()).getCreditScore();
            accrual.accrue(loan, debtPool, score, clock.instant());
            return projection.apply(loan, debtPool, score);
        });
    }

    private Pool readPool(String assetId) {
        store.requirePool(assetId);
        return store.withLocks(Set.of(poolKey(assetId)), () -> {
            Pool pool = store.requirePool(assetId).copy();
            pool.accrueIndices(clock.instant());
            return pool;
        });
    }

    private void resolve(String assetId, String userId) {
        store.requirePool(assetId);
        store.requireUser(userId);
    }

    /** A user may not pull supply of an asset that one of their active loans still owes. */
    private void requireNoLien(CreditRecord user, String assetId) {
        for (String loanId : user.getLoanIds()) {
            Loan loan = store.requireLoan(loanId);
            if (loan.isActive() && loan.getDebtAssetId().equals(assetId)) {
                throw new LendingException(ErrorCode.OUTSTANDING_LOAN,
                        "User " + user.getUserId() + " owes " + assetId + " on loan " + loanId);
            }
        }
    }

    private static Loan requireHeldActive(Loan loan, String holderId) {
        requireHolder(loan, holderId);
        if (!loan.isActive()) {
            throw new LendingException(ErrorCode.LOAN_CLOSED, "Loan " + loan.getLoanId() + " is closed");
        }
        return loan;
    }

    private static void requireHolder(Loan loan, String holderId) {
        if (!loan.getHolderId().equals(holderId)) {
            throw new LendingException(ErrorCode.NOT_LOAN_HOLDER,
                    "User " + holderId + " does not hold loan " + loan.getLoanId());
        }
    }

    private void reopenIfHealthy(Loan loan, CreditRecord borrower) {
        if (loan.getStatus() != LoanStatus.PARTIALLY_LIQUIDATED) return;
        if (!risk.isLiquidatable(risk.healthFactor(loan, prices, borrower.getCreditScore()))) {
            loan.transitionTo(LoanStatus.OPEN);
        }
    }

    private Set<String> loanLockKeys(Loan loan, String actingUserId) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(loanKey(loan.getLoanId()));
        keys.add(userKey(loan.getBorrowerId()));
        keys.add(userKey(loan.getHolderId()));
        keys.add(userKey(actingUserId));
        keys.add(poolKey(loan.getDebtAssetId()));
        keys.add(poolKey(loan.getCollateralAssetId()));
        return keys;
    }

    private <T> T executeOnLoan(String operation, Loan loan, String actingUserId, Function<ProtocolTransaction, T> body) {
        return execute(operation, loanLockKeys(loan, actingUserId), body);
    }

    private <T> T execute(String operation, Set<String> lockKeys, Function<ProtocolTransaction, T> body) {
        try {
            return store.withLocks(lockKeys, () -> {
                ProtocolTransaction tx = new ProtocolTransaction(store, UUID.randomUUID().toString(), clock.instant());
                T result = body.apply(tx);
                tx.commit(custody, operation);
                return result;
            });
        } catch (LendingException e) {
            log.debug("[lending] {} rejected: {} {}", operation, e.getCode(), e.getMessage());
            throw e;
        }
    }

    private static String plain(BigDecimal v) {
        return v.stripTrailingZeros().toPlainString();
    }
}
