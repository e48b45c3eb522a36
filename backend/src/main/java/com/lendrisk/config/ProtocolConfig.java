package com.lendrisk.config;

import com.lendrisk.credit.CreditScorer;
import com.lendrisk.credit.RepaymentTier;
import com.lendrisk.liquidation.LiquidationEngine;
import com.lendrisk.model.Pool;
import com.lendrisk.price.InMemoryPriceFeed;
import com.lendrisk.price.PriceFeed;
import com.lendrisk.rate.KinkedInterestRateModel;
import com.lendrisk.risk.CreditTier;
import com.lendrisk.risk.RiskEngine;
import com.lendrisk.risk.RiskParameters;
import com.lendrisk.service.ProtocolStore;
import com.lendrisk.util.Amounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires the pure risk/credit/liquidation components and the protocol state from {@link AppProps}.
 */
@Configuration
@Slf4j
public class ProtocolConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PriceFeed priceFeed(AppProps props) {
        return new InMemoryPriceFeed(props.getPrices());
    }

    @Bean
    public RiskEngine riskEngine(AppProps props) {
        AppProps.Risk r = props.getRisk();
        RiskParameters params = new RiskParameters(
                Amounts.of(r.getMaxLoanToValue()),
                Amounts.of(r.getLiquidationThreshold()),
                Amounts.of(r.getLiquidationBonus()),
                Amounts.of(r.getCloseFactorHealthFactor()),
                Amounts.of(r.getPartialCloseFactor()));
        List<CreditTier> tiers = props.getCredit().getTiers().stream()
                .map(t -> new CreditTier(t.getMinScore(), Amounts.of(t.getCollateralDiscount()), Amounts.of(t.getInterestDiscount())))
                .toList();
        return new RiskEngine(params, tiers);
    }

    @Bean
    public CreditScorer creditScorer(AppProps props) {
        List<RepaymentTier> tiers = props.getCredit().getRepaymentTiers().stream()
                .map(t -> new RepaymentTier(Amounts.of(t.getRemainingFraction()), t.getPoints()))
                .toList();
        return new CreditScorer(tiers, props.getCredit().getScoreCeiling());
    }

    @Bean
    public LiquidationEngine liquidationEngine(RiskEngine riskEngine, CreditScorer creditScorer) {
        return new LiquidationEngine(riskEngine, creditScorer);
    }

    /** One pool per configured asset, created empty at start-up. */
    @Bean
    public ProtocolStore protocolStore(AppProps props, Clock clock) {
        ProtocolStore store = new ProtocolStore(props.getRisk().getLockTimeout());
        for (AppProps.PoolConfig pc : props.getPools()) {
            AppProps.Rates rates = props.ratesFor(pc);
            KinkedInterestRateModel model = new KinkedInterestRateModel(
                    rates.getBaseRate(), rates.getOptimalUtilization(), rates.getSlopeLow(), rates.getSlopeHigh());
            store.addPool(Pool.create(pc.getAssetId(), pc.getReserveFactor(), model, clock.instant()));
            if (!props.getPrices().containsKey(pc.getAssetId())) {
                log.warn("[config] pool {} has no initial price; risk checks on it fail until one is set", pc.getAssetId());
            }
            log.info("[config] pool {} reserveFactor={} base={} U*={} slopes={}/{}", pc.getAssetId(),
                    pc.getReserveFactor(), rates.getBaseRate(), rates.getOptimalUtilization(),
                    rates.getSlopeLow(), rates.getSlopeHigh());
        }
        return store;
    }
}
