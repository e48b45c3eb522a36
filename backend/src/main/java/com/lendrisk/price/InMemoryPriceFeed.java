package com.lendrisk.price;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import com.lendrisk.util.Amounts;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Price table held in memory, seeded from configuration. */
@Slf4j
public class InMemoryPriceFeed implements PriceFeed {

    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();

    public InMemoryPriceFeed(Map<String, BigDecimal> initial) {
        if (initial != null) initial.forEach(this::setPrice);
    }

    @Override
    public BigDecimal getPrice(String assetId) {
        BigDecimal p = prices.get(assetId);
        if (p == null) throw LendingException.unknownAsset(assetId);
        return p;
    }

    @Override
    public void setPrice(String assetId, BigDecimal price) {
        if (!Amounts.isPositive(price)) {
            throw new LendingException(ErrorCode.INVALID_AMOUNT, "price of " + assetId + " must be > 0, got " + price);
        }
        prices.put(assetId, Amounts.of(price));
        log.info("[price-feed] {} = {}", assetId, price.stripTrailingZeros().toPlainString());
    }
}
