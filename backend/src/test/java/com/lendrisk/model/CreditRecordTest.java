package com.lendrisk.model;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.lendrisk.testsupport.Fixtures.amt;
import static com.lendrisk.testsupport.Fixtures.same;
import static org.junit.jupiter.api.Assertions.*;

class CreditRecordTest {

    private final CreditRecord record = new CreditRecord("u1", "0xabc", Instant.parse("2026-01-01T00:00:00Z"));

    @Test
    @DisplayName("balances cannot go negative")
    void noOverdraw() {
        record.addDeposit("USDC", amt("100"));
        LendingException ex = assertThrows(LendingException.class, () -> record.removeDeposit("USDC", amt("100.01")));
        assertEquals(ErrorCode.INSUFFICIENT_BALANCE, ex.getCode());
        record.removeDeposit("USDC", amt("100"));
        assertTrue(same(amt("0"), record.depositOf("USDC")));
    }

    @Test
    @DisplayName("score only rises and stops at the ceiling")
    void scoreCeiling() {
        assertEquals(0, record.raiseScore(-5, 1000));
        assertEquals(990, record.raiseScore(990, 1000));
        assertEquals(10, record.raiseScore(25, 1000));
        assertEquals(1000, record.getCreditScore());
        assertEquals(0, record.raiseScore(5, 1000));
    }

    @Test
    @DisplayName("exposed collections are read-only")
    void readOnlyViews() {
        assertThrows(UnsupportedOperationException.class, () -> record.getDeposits().put("USDC", amt("1")));
        assertThrows(UnsupportedOperationException.class, () -> record.getLoanIds().add("l1"));
    }

    @Test
    @DisplayName("copy is independent of the original")
    void copyIndependent() {
        CreditRecord copy = record.copy();
        copy.addCollateral("ETH", amt("2"));
        copy.addLoan("l1");
        assertTrue(record.getCollateral().isEmpty());
        assertTrue(record.getLoanIds().isEmpty());
    }
}
