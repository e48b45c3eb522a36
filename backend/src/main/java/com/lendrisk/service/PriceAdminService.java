package com.lendrisk.service;

import com.lendrisk.config.AppProps;
import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import com.lendrisk.price.PriceFeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Privileged price writes. The core itself only ever reads prices.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceAdminService {

    private final PriceFeed priceFeed;
    private final ProtocolStore store;
    private final AppProps props;

    public void setPrice(String adminToken, String assetId, BigDecimal price) {
        requireAdmin(adminToken, assetId);
        store.requirePool(assetId);
        priceFeed.setPrice(assetId, price);
    }

    private void requireAdmin(String adminToken, String assetId) {
        String expected = props.getAdmin().getToken();
        if (expected == null || expected.isBlank() || adminToken == null
                || !MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), adminToken.getBytes(StandardCharsets.UTF_8))) {
            log.warn("[price-admin] rejected price write for {}", assetId);
            throw new LendingException(ErrorCode.UNAUTHORIZED, "Price writes require a valid admin token");
        }
    }
}
