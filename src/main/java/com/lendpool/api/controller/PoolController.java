package com.lendpool.api.controller;

import com.lendpool.api.dto.AmountRequest;
import com.lendpool.api.dto.CollateralRequest;
import com.lendpool.api.dto.LiquidationRequest;
import com.lendpool.api.dto.LiquidationResponse;
import com.lendpool.api.dto.PoolOperationResponse;
import com.lendpool.liquidation.LiquidationResult;
import com.lendpool.pool.LendingPool;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

/**
 * POST /pool/{deposit|withdraw|borrow|repay}, /pool/liquidate, /pool/collateral.
 * Failures surface as LendingException and are mapped by {@link LendingExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/pool")
@RequiredArgsConstructor
public class PoolController {

    private final LendingPool lendingPool;

    @PostMapping("/deposit")
    public ResponseEntity<PoolOperationResponse> deposit(@RequestBody @Valid AmountRequest request) {
        BigDecimal balance = lendingPool.deposit(request.user(), request.asset(), request.amount());
        return ResponseEntity.ok(new PoolOperationResponse("deposit", request.user(), request.asset(), balance));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<PoolOperationResponse> withdraw(@RequestBody @Valid AmountRequest request) {
        BigDecimal withdrawn = lendingPool.withdraw(request.user(), request.asset(), request.amount());
        return ResponseEntity.ok(new PoolOperationResponse("withdraw", request.user(), request.asset(), withdrawn));
    }

    @PostMapping("/borrow")
    public ResponseEntity<PoolOperationResponse> borrow(@RequestBody @Valid AmountRequest request) {
        BigDecimal debt = lendingPool.borrow(request.user(), request.asset(), request.amount());
        return ResponseEntity.ok(new PoolOperationResponse("borrow", request.user(), request.asset(), debt));
    }

    @PostMapping("/repay")
    public ResponseEntity<PoolOperationResponse> repay(@RequestBody @Valid AmountRequest request) {
        BigDecimal repaid = lendingPool.repay(request.user(), request.asset(), request.amount());
        return ResponseEntity.ok(new PoolOperationResponse("repay", request.user(), request.asset(), repaid));
    }

    @PostMapping("/liquidate")
    public ResponseEntity<LiquidationResponse> liquidate(@RequestBody @Valid LiquidationRequest request) {
        LiquidationResult result = lendingPool.liquidate(request.liquidator(), request.borrower(),
                request.debtAsset(), request.collateralAsset(), request.repayAmount());
        return ResponseEntity.ok(new LiquidationResponse(request.borrower(), result.actualRepaid(),
                result.collateralSeized(), result.healthFactorBefore(), result.healthFactorAfter()));
    }

    @PostMapping("/collateral")
    public ResponseEntity<Void> setCollateral(@RequestBody @Valid CollateralRequest request) {
        lendingPool.setUseAsCollateral(request.user(), request.asset(), request.enabled());
        return ResponseEntity.noContent().build();
    }
}
