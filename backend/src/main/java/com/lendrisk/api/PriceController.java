package com.lendrisk.api;

import com.lendrisk.api.dto.PriceUpdateRequest;
import com.lendrisk.service.LendingProtocolService;
import com.lendrisk.service.PriceAdminService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/prices")
@RequiredArgsConstructor
public class PriceController {

    private final LendingProtocolService service;
    private final PriceAdminService priceAdmin;

    @GetMapping("/{assetId}")
    public Map<String, Object> get(@PathVariable String assetId) {
        return Map.of("assetId", assetId, "price", service.getPrice(assetId));
    }

    /** Privileged write; requires the X-Admin-Token header. */
    @PutMapping("/{assetId}")
    public Map<String, Object> set(
            @PathVariable String assetId,
            @RequestHeader(value = "X-Admin-Token", required = false) String adminToken,
            @Validated @RequestBody PriceUpdateRequest req
    ) {
        priceAdmin.setPrice(adminToken, assetId, req.getPrice());
        BigDecimal price = service.getPrice(assetId);
        return Map.of("assetId", assetId, "price", price);
    }
}
