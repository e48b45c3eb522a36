package com.lendrisk.rate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.lendrisk.testsupport.Fixtures.amt;
import static com.lendrisk.testsupport.Fixtures.defaultRates;
import static com.lendrisk.testsupport.Fixtures.same;
import static org.junit.jupiter.api.Assertions.*;

class KinkedInterestRateModelTest {

    private final KinkedInterestRateModel model = defaultRates();

    @Nested
    @DisplayName("borrowRate()")
    class BorrowRate {

        @Test
        @DisplayName("empty pool pays the base rate")
        void zeroUtilization() {
            assertTrue(same(amt("0.02"), model.borrowRate(BigDecimal.ZERO)));
        }

        @Test
        @DisplayName("below the kink the rate climbs by slopeLow")
        void belowKink() {
            assertTrue(same(amt("0.04"), model.borrowRate(amt("0.4"))));
            assertTrue(same(amt("0.06"), model.borrowRate(amt("0.8"))));
        }

        @Test
        @DisplayName("above the kink the rate climbs by slopeHigh over the rest of the range")
        void aboveKink() {
            assertTrue(same(amt("0.435"), model.borrowRate(amt("0.9"))));
            assertTrue(same(amt("0.81"), model.borrowRate(BigDecimal.ONE)));
        }

        @Test
        @DisplayName("utilization outside [0, 1] is clamped")
        void clamped() {
            assertTrue(same(amt("0.02"), model.borrowRate(amt("-0.5"))));
            assertTrue(same(amt("0.81"), model.borrowRate(amt("1.7"))));
        }

        @Test
        @DisplayName("non-decreasing across the whole range")
        void monotonic() {
            BigDecimal prev = model.borrowRate(BigDecimal.ZERO);
            for (int i = 1; i <= 1000; i++) {
                BigDecimal u = BigDecimal.valueOf(i).movePointLeft(3);
                BigDecimal r = model.borrowRate(u);
                assertTrue(r.compareTo(prev) >= 0, "rate dropped at u=" + u);
                prev = r;
            }
        }

        @Test
        @DisplayName("continuous at the kink")
        void continuousAtKink() {
            BigDecimal atKink = model.borrowRate(amt("0.8"));
            BigDecimal justAbove = model.borrowRate(amt("0.800000001"));
            assertTrue(justAbove.subtract(atKink).abs().compareTo(amt("0.000001")) < 0);
        }
    }

    @Test
    @DisplayName("supply rate = borrow × utilization × (1 − reserveFactor)")
    void supplyRate() {
        // borrow(0.5) = 0.02 + 0.04 × 0.625 = 0.045
        assertTrue(same(amt("0.02025"), model.supplyRate(amt("0.5"), amt("0.10"))));
        assertTrue(same(BigDecimal.ZERO, model.supplyRate(BigDecimal.ZERO, amt("0.10"))));
    }

    @Test
    @DisplayName("rejects a kink outside (0, 1) and negative slopes")
    void invalidParameters() {
        assertThrows(IllegalArgumentException.class,
                () -> new KinkedInterestRateModel(amt("0.02"), BigDecimal.ONE, amt("0.04"), amt("0.75")));
        assertThrows(IllegalArgumentException.class,
                () -> new KinkedInterestRateModel(amt("0.02"), amt("0.8"), amt("-0.04"), amt("0.75")));
    }
}
