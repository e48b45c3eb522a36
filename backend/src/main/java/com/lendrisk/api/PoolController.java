package com.lendrisk.api;

import com.lendrisk.api.dto.BalanceRequest;
import com.lendrisk.api.dto.PoolView;
import com.lendrisk.service.LendingProtocolService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Pool state and the supply-side operations of one asset.
 * Example:
 *   POST /api/v1/pools/USDC/deposit {"userId":"…","amount":1000}
 */
@RestController
@RequestMapping("/api/v1/pools")
@RequiredArgsConstructor
public class PoolController {

    private final LendingProtocolService service;

    @GetMapping
    public List<PoolView> list() {
        return service.getPools().stream().map(PoolView::from).toList();
    }

    @GetMapping("/{assetId}")
    public PoolView get(@PathVariable String assetId) {
        return PoolView.from(service.getPool(assetId));
    }

    @PostMapping("/{assetId}/deposit")
    public PoolView deposit(@PathVariable String assetId, @Validated @RequestBody BalanceRequest req) {
        service.deposit(req.getUserId(), assetId, req.getAmount());
        return PoolView.from(service.getPool(assetId));
    }

    @PostMapping("/{assetId}/withdraw")
    public PoolView withdraw(@PathVariable String assetId, @Validated @RequestBody BalanceRequest req) {
        service.withdraw(req.getUserId(), assetId, req.getAmount());
        return PoolView.from(service.getPool(assetId));
    }

    @PostMapping("/{assetId}/collateral")
    public PoolView depositCollateral(@PathVariable String assetId, @Validated @RequestBody BalanceRequest req) {
        service.depositCollateral(req.getUserId(), assetId, req.getAmount());
        return PoolView.from(service.getPool(assetId));
    }

    @PostMapping("/{assetId}/collateral/withdraw")
    public PoolView withdrawCollateral(@PathVariable String assetId, @Validated @RequestBody BalanceRequest req) {
        service.withdrawCollateral(req.getUserId(), assetId, req.getAmount());
        return PoolView.from(service.getPool(assetId));
    }

    @PostMapping("/{assetId}/convert-to-collateral")
    public PoolView convertToCollateral(@PathVariable String assetId, @Validated @RequestBody BalanceRequest req) {
        service.convertToCollateral(req.getUserId(), assetId, req.getAmount());
        return PoolView.from(service.getPool(assetId));
    }

    @PostMapping("/{assetId}/convert-to-deposit")
    public PoolView convertToDeposit(@PathVariable String assetId, @Validated @RequestBody BalanceRequest req) {
        service.convertToDeposit(req.getUserId(), assetId, req.getAmount());
        return PoolView.from(service.getPool(assetId));
    }
}
