package com.lendrisk.testsupport;

import com.lendrisk.credit.CreditScorer;
import com.lendrisk.credit.RepaymentTier;
import com.lendrisk.rate.KinkedInterestRateModel;
import com.lendrisk.risk.CreditTier;
import com.lendrisk.risk.RiskEngine;
import com.lendrisk.risk.RiskParameters;
import com.lendrisk.util.Amounts;

import java.math.BigDecimal;
import java.util.List;

/** Default protocol parameters shared by the domain tests. */
public final class Fixtures {
    private Fixtures() {}

    public static BigDecimal amt(String v) {
        return Amounts.of(v);
    }

    public static boolean same(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) == 0;
    }

    public static KinkedInterestRateModel defaultRates() {
        return new KinkedInterestRateModel(amt("0.02"), amt("0.80"), amt("0.04"), amt("0.75"));
    }

    public static RiskParameters riskParams(String liquidationThreshold) {
        return new RiskParameters(amt("0.75"), amt(liquidationThreshold), amt("0.05"), amt("0.5"), amt("0.5"));
    }

    public static List<CreditTier> creditTiers() {
        return List.of(
                new CreditTier(100, amt("0.05"), amt("0.01")),
                new CreditTier(200, amt("0.10"), amt("0.02")),
                new CreditTier(300, amt("0.15"), amt("0.03")));
    }

    public static RiskEngine riskEngine() {
        return new RiskEngine(riskParams("0.80"), creditTiers());
    }

    public static CreditScorer creditScorer() {
        return new CreditScorer(List.of(
                new RepaymentTier(amt("0.75"), 5),
                new RepaymentTier(amt("0.50"), 5),
                new RepaymentTier(amt("0.25"), 5),
                new RepaymentTier(amt("0"), 5)), 1000);
    }
}
