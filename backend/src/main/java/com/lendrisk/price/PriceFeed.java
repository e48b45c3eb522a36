package com.lendrisk.price;

import java.math.BigDecimal;

/**
 * Trusted external price source. The core only reads from it.
 */
public interface PriceFeed {

    /** Unit price of the asset; throws UNKNOWN_ASSET when no price is known. */
    BigDecimal getPrice(String assetId);

    /** Privileged write, used for demos and tests. */
    void setPrice(String assetId, BigDecimal price);
}
