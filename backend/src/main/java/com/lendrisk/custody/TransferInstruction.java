package com.lendrisk.custody;

import java.math.BigDecimal;

/**
 * Token movement the external ledger must execute together with the state change that produced it.
 */
public record TransferInstruction(String assetId, BigDecimal amount, String from, String to) {

    public static String userAccount(String userId) {
        return "user:" + userId;
    }

    public static String poolAccount(String assetId) {
        return "pool:" + assetId;
    }

    public static String collateralAccount(String assetId) {
        return "collateral:" + assetId;
    }
}
