package com.lendrisk.risk;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import com.lendrisk.model.Loan;
import com.lendrisk.model.Pool;
import com.lendrisk.price.InMemoryPriceFeed;
import com.lendrisk.price.PriceFeed;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static com.lendrisk.testsupport.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RiskEngineTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final PriceFeed prices = new InMemoryPriceFeed(Map.of(
            "USDC", BigDecimal.ONE,
            "DAI", BigDecimal.ONE,
            "ETH", new BigDecimal("2500")));
    private final RiskEngine risk = riskEngine();

    private static Loan loan(String collateralAsset, String collateral, String debtAsset, String debt) {
        return Loan.open("l1", "u1", collateralAsset, amt(collateral), debtAsset, amt(debt), amt("0.05"), T0);
    }

    @Nested
    @DisplayName("health factor")
    class Health {

        @Test
        @DisplayName("(collateralValue × LT) / debtValue of 1.0 is exactly liquidatable")
        void boundaryIsLiquidatable() {
            RiskEngine engine = new RiskEngine(riskParams("0.9"), creditTiers());
            HealthFactor hf = engine.healthFactor(loan("USDC", "10000", "DAI", "9000"), prices, 0);
            assertTrue(same(BigDecimal.ONE, hf.value()));
            assertTrue(engine.isLiquidatable(hf));
        }

        @Test
        @DisplayName("values both sides at their own price")
        void crossAsset() {
            // 2 ETH = 5000 USD, × 0.8 / 2000
            HealthFactor hf = risk.healthFactor(loan("ETH", "2", "USDC", "2000"), prices, 0);
            assertTrue(same(amt("2"), hf.value()));
            assertFalse(risk.isLiquidatable(hf));
        }

        @Test
        @DisplayName("no debt means infinitely safe")
        void noDebtIsInfinite() {
            HealthFactor hf = risk.healthFactor(amt("1"), "ETH", BigDecimal.ZERO, "USDC", prices, 0);
            assertTrue(hf.isInfinite());
            assertFalse(risk.isLiquidatable(hf));
            assertTrue(hf.compareTo(HealthFactor.of(amt("1000000"))) > 0);
        }

        @Test
        @DisplayName("an asset without a price is UNKNOWN_ASSET")
        void unknownPrice() {
            LendingException ex = assertThrows(LendingException.class,
                    () -> risk.healthFactor(loan("DOGE", "1", "USDC", "1"), prices, 0));
            assertEquals(ErrorCode.UNKNOWN_ASSET, ex.getCode());
        }
    }

    @Nested
    @DisplayName("credit tiers")
    class Tiers {

        @Test
        @DisplayName("score 200 relaxes the threshold by 0.10 and cuts the rate by 0.02 against score 0")
        void score200AgainstBaseline() {
            RiskTerms baseline = risk.termsFor(0);
            RiskTerms good = risk.termsFor(200);
            assertTrue(same(amt("0.10"), good.liquidationThreshold().subtract(baseline.liquidationThreshold())));
            assertTrue(same(amt("0.10"), good.maxLoanToValue().subtract(baseline.maxLoanToValue())));
            assertTrue(same(amt("0.02"), good.interestDiscount()));
            assertTrue(same(BigDecimal.ZERO, baseline.interestDiscount()));

            Loan l = loan("USDC", "1000", "DAI", "900");
            assertTrue(risk.isLiquidatable(risk.healthFactor(l, prices, 0)));
            assertTrue(same(BigDecimal.ONE, risk.healthFactor(l, prices, 200).value()));

            Pool pool = Pool.create("DAI", amt("0.1"), defaultRates(), T0);
            pool.deposit(amt("1000"), T0);
            pool.borrow(amt("400"), T0);   // u = 0.4, rate 0.04
            assertTrue(same(amt("0.04"), risk.borrowRateFor(pool, 0)));
            assertTrue(same(amt("0.02"), risk.borrowRateFor(pool, 200)));
        }

        @Test
        @DisplayName("tier boundaries are inclusive lower bounds")
        void boundaries() {
            assertTrue(same(amt("0.80"), risk.termsFor(99).liquidationThreshold()));
            assertTrue(same(amt("0.85"), risk.termsFor(100).liquidationThreshold()));
            assertTrue(same(amt("0.90"), risk.termsFor(299).liquidationThreshold()));
            assertTrue(same(amt("0.95"), risk.termsFor(1000).liquidationThreshold()));
        }

        @Test
        @DisplayName("discounted rate never goes below zero")
        void rateFloor() {
            Pool empty = Pool.create("DAI", amt("0.1"), defaultRates(), T0);
            assertTrue(same(BigDecimal.ZERO, risk.borrowRateFor(empty, 300)));
        }
    }

    @Nested
    @DisplayName("borrow gating")
    class Borrow {

        @Test
        @DisplayName("75% of collateral value is allowed, one unit more is not")
        void maxLoanToValue() {
            assertDoesNotThrow(() -> risk.checkBorrow(amt("10000"), "USDC", amt("7500"), "DAI", prices, 0));
            LendingException ex = assertThrows(LendingException.class,
                    () -> risk.checkBorrow(amt("10000"), "USDC", amt("7501"), "DAI", prices, 0));
            assertEquals(ErrorCode.EXCEEDS_MAX_BORROW, ex.getCode());
        }

        @Test
        @DisplayName("headroom is the remaining borrow limit in debt units")
        void headroom() {
            assertTrue(same(amt("500"), risk.maxAdditionalBorrow(amt("10000"), "USDC", amt("7000"), "DAI", prices, 0)));
            assertTrue(same(amt("3750"), risk.maxAdditionalBorrow(amt("2"), "ETH", BigDecimal.ZERO, "USDC", prices, 0)));
            assertTrue(same(BigDecimal.ZERO, risk.maxAdditionalBorrow(amt("100"), "USDC", amt("90"), "DAI", prices, 0)));
        }
    }

    @Nested
    @DisplayName("liquidation size")
    class CloseFactor {

        @Test
        @DisplayName("above 1 nothing may be liquidated")
        void healthy() {
            Loan l = loan("USDC", "2000", "DAI", "1000");
            assertTrue(same(BigDecimal.ZERO, risk.maxLiquidatable(l, HealthFactor.of(amt("1.01")))));
        }

        @Test
        @DisplayName("in (0.5, 1] half of the debt")
        void partial() {
            Loan l = loan("USDC", "2000", "DAI", "1000");
            assertTrue(same(amt("500"), risk.maxLiquidatable(l, HealthFactor.of(BigDecimal.ONE))));
            assertTrue(same(amt("500"), risk.maxLiquidatable(l, HealthFactor.of(amt("0.51")))));
        }

        @Test
        @DisplayName("at or below 0.5 the whole debt")
        void full() {
            Loan l = loan("USDC", "2000", "DAI", "1000");
            assertTrue(same(amt("1000"), risk.maxLiquidatable(l, HealthFactor.of(amt("0.5")))));
            assertTrue(same(amt("1000"), risk.maxLiquidatable(l, HealthFactor.of(amt("0.4")))));
        }
    }
}
