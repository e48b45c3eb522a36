package com.lendrisk.model;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import com.lendrisk.rate.InterestRateModel;
import com.lendrisk.util.Amounts;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregate ledger for one asset: supplied liquidity, outstanding borrows, posted collateral
 * and the cumulative supply/borrow indices.
 *
 * Invariant: {@code totalBorrowed <= totalSupply}. Every mutating call accrues the indices first.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Pool {

    private final String assetId;
    private final BigDecimal reserveFactor;
    private final InterestRateModel rateModel;

    /** Supplied principal plus interest accrued from borrowers (reserves included). */
    private BigDecimal totalSupply;
    private BigDecimal totalBorrowed;
    /** Protocol share of accrued interest, part of totalSupply. */
    private BigDecimal reserves;
    /** Collateral posted in this asset (free and locked in loans). */
    private BigDecimal totalCollateral;

    private BigDecimal liquidityIndex;
    private BigDecimal borrowIndex;
    private Instant lastUpdateTimestamp;

    public static Pool create(String assetId, BigDecimal reserveFactor, InterestRateModel rateModel, Instant now) {
        if (reserveFactor.signum() < 0 || reserveFactor.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("reserveFactor must be in [0, 1): " + reserveFactor);
        }
        return Pool.builder()
                .assetId(assetId)
                .reserveFactor(Amounts.of(reserveFactor))
                .rateModel(rateModel)
                .totalSupply(Amounts.ZERO)
                .totalBorrowed(Amounts.ZERO)
                .reserves(Amounts.ZERO)
                .totalCollateral(Amounts.ZERO)
                .liquidityIndex(Amounts.ONE)
                .borrowIndex(Amounts.ONE)
                .lastUpdateTimestamp(now)
                .build();
    }

    public Pool copy() {
        return toBuilder().build();
    }

    // ---------- derived ----------

    /** totalBorrowed / totalSupply; 0 for an empty pool. */
    public BigDecimal utilizationRate() {
        if (totalSupply.signum() == 0) return Amounts.ZERO;
        return Amounts.div(totalBorrowed, totalSupply);
    }

    public BigDecimal availableLiquidity() {
        return totalSupply.subtract(totalBorrowed);
    }

    public BigDecimal borrowRate() {
        return rateModel.borrowRate(utilizationRate());
    }

    public BigDecimal supplyRate() {
        return rateModel.supplyRate(utilizationRate(), reserveFactor);
    }

    // ---------- mutations ----------

    /**
     * Compounds the current rates over the time elapsed since the last update.
     * A second call at the same timestamp is a no-op; a timestamp in the past is ignored.
     */
    public void accrueIndices(Instant now) {
        if (!now.isAfter(lastUpdateTimestamp)) return;
        BigDecimal yearFraction = Amounts.yearFraction(lastUpdateTimestamp, now);

        BigDecimal borrowGrowth = Amounts.ONE.add(Amounts.mul(borrowRate(), yearFraction));
        BigDecimal supplyGrowth = Amounts.ONE.add(Amounts.mul(supplyRate(), yearFraction));
        borrowIndex = Amounts.mul(borrowIndex, borrowGrowth);
        liquidityIndex = Amounts.mul(liquidityIndex, supplyGrowth);
        lastUpdateTimestamp = now;
    }

    public void deposit(BigDecimal amount, Instant now) {
        requirePositive(amount);
        accrueIndices(now);
        totalSupply = totalSupply.add(amount);
    }

    public void withdraw(BigDecimal amount, Instant now) {
        requirePositive(amount);
        accrueIndices(now);
        requireLiquidity(amount, "withdraw");
        totalSupply = totalSupply.subtract(amount);
    }

    public void borrow(BigDecimal amount, Instant now) {
        requirePositive(amount);
        accrueIndices(now);
        requireLiquidity(amount, "borrow");
        totalBorrowed = totalBorrowed.add(amount);
    }

    /** Returns the amount actually applied, i.e. {@code min(amount, totalBorrowed)}. */
    public BigDecimal repay(BigDecimal amount, Instant now) {
        requirePositive(amount);
        accrueIndices(now);
        BigDecimal applied = Amounts.min(amount, totalBorrowed);
        totalBorrowed = totalBorrowed.subtract(applied);
        return applied;
    }

    /**
     * Books borrower interest: debt and supply grow by the same amount, the reserve factor share
     * of it is earmarked as protocol reserves.
     */
    public void bookInterest(BigDecimal interest) {
        if (interest.signum() <= 0) return;
        totalBorrowed = totalBorrowed.add(interest);
        totalSupply = totalSupply.add(interest);
        reserves = reserves.add(Amounts.mul(interest, reserveFactor));
    }

    public void addCollateral(BigDecimal amount) {
        totalCollateral = totalCollateral.add(amount);
    }

    public void removeCollateral(BigDecimal amount) {
        if (amount.compareTo(totalCollateral) > 0) {
            throw new IllegalStateException("collateral vault of " + assetId + " holds " + totalCollateral
                    + ", cannot release " + amount);
        }
        totalCollateral = totalCollateral.subtract(amount);
    }

    private void requireLiquidity(BigDecimal amount, String op) {
        BigDecimal available = availableLiquidity();
        if (amount.compareTo(available) > 0) {
            throw new LendingException(ErrorCode.INSUFFICIENT_LIQUIDITY,
                    "[" + op + "] " + assetId + ": requested " + amount.stripTrailingZeros().toPlainString()
                            + ", available " + available.stripTrailingZeros().toPlainString());
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (!Amounts.isPositive(amount)) {
            throw new LendingException(ErrorCode.INVALID_AMOUNT, "amount must be > 0, got " + amount);
        }
    }
}
