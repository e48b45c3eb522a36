package com.lendrisk.api;

import com.lendrisk.api.dto.BorrowRequest;
import com.lendrisk.api.dto.HealthFactorView;
import com.lendrisk.api.dto.LiquidateRequest;
import com.lendrisk.api.dto.LiquidationView;
import com.lendrisk.api.dto.LoanAmountRequest;
import com.lendrisk.api.dto.LoanView;
import com.lendrisk.api.dto.ReassignHolderRequest;
import com.lendrisk.service.LendingProtocolService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Borrow-side operations and loan queries. Loan operations are authorized against the loan's current holder.
 */
@RestController
@RequestMapping("/api/v1/loans")
@RequiredArgsConstructor
public class LoanController {

    private final LendingProtocolService service;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public LoanView open(@Validated @RequestBody BorrowRequest req) {
        String loanId = service.borrow(req.getUserId(), req.getDebtAssetId(), req.getCollateralAssetId(),
                req.getCollateralAmount(), req.getAmount());
        return LoanView.from(service.getLoan(loanId));
    }

    /** Ids of active loans at or below health factor 1, evaluated now. */
    @GetMapping("/bad")
    public List<String> bad(@RequestParam(defaultValue = "1000") int limit) {
        return service.findBadLoans().limit(Math.max(0, limit)).toList();
    }

    @GetMapping("/{loanId}")
    public LoanView get(@PathVariable String loanId) {
        return LoanView.from(service.getLoan(loanId));
    }

    @GetMapping("/{loanId}/health")
    public HealthFactorView health(@PathVariable String loanId) {
        return HealthFactorView.of(loanId, service.getHealthFactor(loanId));
    }

    @GetMapping("/{loanId}/max-borrow")
    public Map<String, BigDecimal> maxBorrow(@PathVariable String loanId) {
        return Map.of("maxBorrow", service.getMaxBorrow(loanId));
    }

    @PostMapping("/{loanId}/borrow")
    public LoanView borrowMore(@PathVariable String loanId, @Validated @RequestBody LoanAmountRequest req) {
        service.borrowAdditional(loanId, req.getHolderId(), req.getAmount());
        return LoanView.from(service.getLoan(loanId));
    }

    @PostMapping("/{loanId}/repay")
    public LoanView repay(@PathVariable String loanId, @Validated @RequestBody LoanAmountRequest req) {
        service.repay(loanId, req.getHolderId(), req.getAmount());
        return LoanView.from(service.getLoan(loanId));
    }

    @PostMapping("/{loanId}/collateral")
    public LoanView addCollateral(@PathVariable String loanId, @Validated @RequestBody LoanAmountRequest req) {
        service.addCollateral(loanId, req.getHolderId(), req.getAmount());
        return LoanView.from(service.getLoan(loanId));
    }

    @PostMapping("/{loanId}/liquidate")
    public LiquidationView liquidate(@PathVariable String loanId, @Validated @RequestBody LiquidateRequest req) {
        return LiquidationView.from(service.liquidate(loanId, req.getLiquidatorId(), req.getRepayAmount()));
    }

    @PostMapping("/{loanId}/holder")
    public LoanView reassignHolder(@PathVariable String loanId, @Validated @RequestBody ReassignHolderRequest req) {
        service.reassignHolder(loanId, req.getCurrentHolderId(), req.getNewHolderId());
        return LoanView.from(service.getLoan(loanId));
    }
}
