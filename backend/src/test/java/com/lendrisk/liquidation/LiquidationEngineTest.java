package com.lendrisk.liquidation;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import com.lendrisk.model.CreditRecord;
import com.lendrisk.model.Loan;
import com.lendrisk.model.LoanStatus;
import com.lendrisk.model.Pool;
import com.lendrisk.price.InMemoryPriceFeed;
import com.lendrisk.price.PriceFeed;
import com.lendrisk.risk.RiskEngine;
import com.lendrisk.risk.RiskParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static com.lendrisk.testsupport.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LiquidationEngineTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final PriceFeed prices = new InMemoryPriceFeed(Map.of("COL", BigDecimal.ONE, "DEBT", BigDecimal.ONE));
    private final RiskEngine risk = riskEngine();
    private final LiquidationEngine engine = new LiquidationEngine(risk, creditScorer());

    /** Loan with {@code collateral} COL against {@code debt} DEBT, both priced at 1. LT is 0.8. */
    private final class Position {
        final Pool debtPool = Pool.create("DEBT", amt("0.1"), defaultRates(), T0);
        final Pool collateralPool = Pool.create("COL", amt("0.1"), defaultRates(), T0);
        final CreditRecord borrower = new CreditRecord("b1", "0x01", T0);
        final Loan loan;

        Position(String collateral, String debt) {
            debtPool.deposit(amt("100000"), T0);
            debtPool.borrow(amt(debt), T0);
            collateralPool.addCollateral(amt(collateral));
            loan = Loan.open("l1", "b1", "COL", amt(collateral), "DEBT", amt(debt), amt("0.05"), T0);
        }

        LiquidationResult liquidate(String repay) {
            return liquidate(engine, borrower, prices, repay);
        }

        LiquidationResult liquidate(LiquidationEngine with, CreditRecord holder, PriceFeed feed, String repay) {
            return with.liquidate(loan, debtPool, collateralPool, borrower, holder, "liq", amt(repay), feed, T0);
        }
    }

    @Nested
    @DisplayName("deep underwater (HF 0.4): full close allowed")
    class FullClose {

        @Test
        @DisplayName("repaying 1001 of 1000 exceeds the limit")
        void overLimit() {
            Position p = new Position("500", "1000");
            LendingException ex = assertThrows(LendingException.class, () -> p.liquidate("1001"));
            assertEquals(ErrorCode.EXCEEDS_LIQUIDATION_LIMIT, ex.getCode());
        }

        @Test
        @DisplayName("repaying the full 1000 closes the loan and reports the seizure shortfall")
        void fullRepayWithShortfall() {
            Position p = new Position("500", "1000");
            LiquidationResult r = p.liquidate("1000");

            assertEquals(LoanStatus.CLOSED, r.getStatus());
            assertTrue(r.getHealthAfter().isInfinite());
            assertTrue(same(amt("0.4"), r.getHealthBefore().value()));
            assertTrue(r.isSeizureShortfall());
            assertTrue(same(amt("500"), r.getCollateralSeized()));
            assertTrue(same(amt("550"), r.getShortfall()));    // 1050 owed, 500 available
            assertTrue(same(BigDecimal.ZERO, p.loan.getCollateralAmount()));
            assertTrue(same(BigDecimal.ZERO, p.collateralPool.getTotalCollateral()));
            assertTrue(same(BigDecimal.ZERO, p.debtPool.getTotalBorrowed()));
            assertEquals(1, p.borrower.getDefaults());
        }

        @Test
        @DisplayName("a capped seizure that leaves debt behind is refused")
        void partialWithShortfall() {
            Position p = new Position("500", "1000");
            LendingException ex = assertThrows(LendingException.class, () -> p.liquidate("600"));
            assertEquals(ErrorCode.PARTIAL_SEIZURE_SHORTFALL, ex.getCode());
        }
    }

    @Nested
    @DisplayName("mildly unhealthy (HF in (0.5, 1]): half of the debt")
    class PartialClose {

        @Test
        @DisplayName("repays half, seizes value plus 5% bonus and improves health")
        void improvesHealth() {
            Position p = new Position("1100", "1000");   // HF 0.88
            LiquidationResult r = p.liquidate("500");

            assertEquals(LoanStatus.PARTIALLY_LIQUIDATED, r.getStatus());
            assertTrue(same(amt("525"), r.getCollateralSeized()));
            assertFalse(r.isSeizureShortfall());
            assertTrue(same(amt("575"), p.loan.getCollateralAmount()));
            assertTrue(same(amt("500"), p.loan.debt()));
            assertTrue(same(amt("0.92"), r.getHealthAfter().value()));
            assertTrue(r.getHealthAfter().compareTo(r.getHealthBefore()) > 0);
            assertTrue(same(amt("500"), p.debtPool.getTotalBorrowed()));
            assertTrue(same(amt("575"), p.collateralPool.getTotalCollateral()));
        }

        @Test
        @DisplayName("more than half of the debt exceeds the limit")
        void overHalf() {
            Position p = new Position("1100", "1000");
            LendingException ex = assertThrows(LendingException.class, () -> p.liquidate("500.000001"));
            assertEquals(ErrorCode.EXCEEDS_LIQUIDATION_LIMIT, ex.getCode());
        }

        @Test
        @DisplayName("health factor exactly 1 is eligible")
        void boundary() {
            Position p = new Position("1250", "1000");
            LiquidationResult r = p.liquidate("500");
            assertTrue(same(BigDecimal.ONE, r.getHealthBefore().value()));
            assertTrue(r.getHealthAfter().compareTo(r.getHealthBefore()) > 0);
        }

        @Test
        @DisplayName("a liquidation that would lower health is refused")
        void healthNotImproved() {
            Position p = new Position("1000", "1000");   // HF 0.8: bonus outweighs the repayment
            LendingException ex = assertThrows(LendingException.class, () -> p.liquidate("500"));
            assertEquals(ErrorCode.HEALTH_NOT_IMPROVED, ex.getCode());
        }

        @Test
        @DisplayName("counts a default and scores the repayment for the borrower")
        void creditEffects() {
            Position p = new Position("1100", "1000");
            p.liquidate("500");   // remaining 50%
            assertEquals(1, p.borrower.getDefaults());
            assertEquals(10, p.borrower.getCreditScore());
            assertEquals(1, p.borrower.getRepaymentHistory().size());
        }
    }

    @Nested
    @DisplayName("ineligible loans")
    class Ineligible {

        @Test
        @DisplayName("healthy loan is NOT_LIQUIDATABLE")
        void healthy() {
            Position p = new Position("2000", "1000");
            LendingException ex = assertThrows(LendingException.class, () -> p.liquidate("1"));
            assertEquals(ErrorCode.NOT_LIQUIDATABLE, ex.getCode());
        }

        @Test
        @DisplayName("closed loan is NOT_LIQUIDATABLE")
        void closed() {
            Position p = new Position("500", "1000");
            p.loan.applyRepayment(amt("1000"));
            p.loan.transitionTo(LoanStatus.CLOSED);
            LendingException ex = assertThrows(LendingException.class, () -> p.liquidate("1"));
            assertEquals(ErrorCode.NOT_LIQUIDATABLE, ex.getCode());
        }
    }

    @Nested
    @DisplayName("closing a loan with collateral to spare")
    class Leftover {

        /** Full close allowed up to HF 1, so a loan with collateral above debt + bonus can be closed. */
        private final LiquidationEngine fullCloseEngine = new LiquidationEngine(
                new RiskEngine(new RiskParameters(amt("0.75"), amt("0.80"), amt("0.05"), amt("1"), amt("0.5")),
                        creditTiers()),
                creditScorer());

        @Test
        @DisplayName("the remainder goes to the loan holder, the default to the borrower")
        void remainderToHolder() {
            Position p = new Position("1200", "1000");   // HF 0.96
            CreditRecord holder = new CreditRecord("h1", "0x02", T0);
            p.loan.reassignHolder("h1");

            LiquidationResult r = p.liquidate(fullCloseEngine, holder, prices, "1000");

            assertEquals(LoanStatus.CLOSED, r.getStatus());
            assertTrue(same(amt("1050"), r.getCollateralSeized()));
            assertTrue(same(amt("150"), r.getCollateralReleased()));
            assertTrue(same(amt("150"), holder.collateralOf("COL")));
            assertTrue(same(BigDecimal.ZERO, p.borrower.collateralOf("COL")));
            assertEquals(1, p.borrower.getDefaults());
            assertEquals(0, holder.getDefaults());
        }

        @Test
        @DisplayName("a record that does not hold the loan is refused")
        void wrongHolder() {
            Position p = new Position("1200", "1000");
            CreditRecord other = new CreditRecord("h1", "0x02", T0);
            assertThrows(IllegalArgumentException.class,
                    () -> p.liquidate(fullCloseEngine, other, prices, "1000"));
        }
    }

    @Test
    @DisplayName("prices are read once per liquidation, so a moving feed cannot skew the health check")
    void pricesReadOnce() {
        PriceFeed moving = new PriceFeed() {
            private int collateralReads;

            @Override
            public BigDecimal getPrice(String assetId) {
                if (!assetId.equals("COL")) return BigDecimal.ONE;
                return collateralReads++ == 0 ? BigDecimal.ONE : new BigDecimal("0.5");
            }

            @Override
            public void setPrice(String assetId, BigDecimal price) {
                throw new UnsupportedOperationException();
            }
        };
        Position p = new Position("1100", "1000");
        LiquidationResult r = p.liquidate(engine, p.borrower, moving, "500");

        assertTrue(same(amt("525"), r.getCollateralSeized()));
        assertTrue(same(amt("0.88"), r.getHealthBefore().value()));
        assertTrue(same(amt("0.92"), r.getHealthAfter().value()));
    }

    @Test
    @DisplayName("seizure converts repaid value at both prices")
    void seizureAcrossPrices() {
        PriceFeed feed = new InMemoryPriceFeed(Map.of("COL", new BigDecimal("2000"), "DEBT", BigDecimal.ONE));
        Loan l = Loan.open("l1", "b1", "COL", amt("1"), "DEBT", amt("1000"), amt("0.05"), T0);
        // 1000 USD / 2000 × 1.05
        assertTrue(same(amt("0.525"), engine.seizureFor(amt("1000"), l, feed)));
    }
}
