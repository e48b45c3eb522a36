package com.lendrisk.price;

import com.lendrisk.exception.LendingException;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Prices of a fixed set of assets, read once from a live feed. Every check of one operation sees the
 * same quotes even if the live feed moves meanwhile.
 */
public final class PriceSnapshot implements PriceFeed {

    private final Map<String, BigDecimal> quotes;

    private PriceSnapshot(Map<String, BigDecimal> quotes) {
        this.quotes = quotes;
    }

    public static PriceSnapshot of(PriceFeed source, String... assetIds) {
        Map<String, BigDecimal> quotes = new HashMap<>();
        for (String assetId : assetIds) {
            quotes.computeIfAbsent(assetId, source::getPrice);
        }
        return new PriceSnapshot(quotes);
    }

    @Override
    public BigDecimal getPrice(String assetId) {
        BigDecimal p = quotes.get(assetId);
        if (p == null) throw LendingException.unknownAsset(assetId);
        return p;
    }

    @Override
    public void setPrice(String assetId, BigDecimal price) {
        throw new UnsupportedOperationException("price snapshot is read-only");
    }
}
