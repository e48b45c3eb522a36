package com.lendrisk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "app")
@Data
public class AppProps {
    private Rates rates = new Rates();
    private List<PoolConfig> pools = new ArrayList<>();
    /** assetId -> initial unit price. */
    private Map<String, BigDecimal> prices = new LinkedHashMap<>();
    private Risk risk = new Risk();
    private Credit credit = new Credit();
    private Admin admin = new Admin();

    /** Rate curve of the pool, falling back to the protocol-wide curve. */
    public Rates ratesFor(PoolConfig pool) {
        return pool.getRates() != null ? pool.getRates() : rates;
    }

    @Data
    public static class Rates {
        private BigDecimal baseRate = new BigDecimal("0.02");
        private BigDecimal optimalUtilization = new BigDecimal("0.80");
        private BigDecimal slopeLow = new BigDecimal("0.04");
        private BigDecimal slopeHigh = new BigDecimal("0.75");
    }

    @Data
    public static class PoolConfig {
        private String assetId;
        private BigDecimal reserveFactor = new BigDecimal("0.10");
        private Rates rates;
    }

    @Data
    public static class Risk {
        private BigDecimal maxLoanToValue = new BigDecimal("0.75");
        private BigDecimal liquidationThreshold = new BigDecimal("0.80");
        private BigDecimal liquidationBonus = new BigDecimal("0.05");
        private BigDecimal closeFactorHealthFactor = new BigDecimal("0.5");
        private BigDecimal partialCloseFactor = new BigDecimal("0.5");
        private Duration lockTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Credit {
        private List<Tier> tiers = new ArrayList<>(List.of(
                tier(100, "0.05", "0.01"),
                tier(200, "0.10", "0.02"),
                tier(300, "0.15", "0.03")));
        private List<RepaymentTier> repaymentTiers = new ArrayList<>(List.of(
                repaymentTier("0.75", 5),
                repaymentTier("0.50", 5),
                repaymentTier("0.25", 5),
                repaymentTier("0", 5)));
        private int scoreCeiling = 1000;
    }

    @Data
    public static class Tier {
        private int minScore;
        private BigDecimal collateralDiscount;
        private BigDecimal interestDiscount;
    }

    @Data
    public static class RepaymentTier {
        private BigDecimal remainingFraction;
        private int points;
    }

    @Data
    public static class Admin {
        /** Shared secret for privileged writes (X-Admin-Token). Writes are refused while blank. */
        private String token;
    }

    private static Tier tier(int minScore, String collateralDiscount, String interestDiscount) {
        Tier t = new Tier();
        t.setMinScore(minScore);
        t.setCollateralDiscount(new BigDecimal(collateralDiscount));
        t.setInterestDiscount(new BigDecimal(interestDiscount));
        return t;
    }

    private static RepaymentTier repaymentTier(String remainingFraction, int points) {
        RepaymentTier t = new RepaymentTier();
        t.setRemainingFraction(new BigDecimal(remainingFraction));
        t.setPoints(points);
        return t;
    }
}
