package com.lendpool.api.controller;

import com.lendpool.api.dto.AccountResponse;
import com.lendpool.api.dto.HealthFactorResponse;
import com.lendpool.pool.LendingPool;
import com.lendpool.pool.UserAccountData;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * GET /accounts/{user}, GET /accounts/{user}/health-factor.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final LendingPool lendingPool;

    @GetMapping("/{user}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable String user) {
        UserAccountData account = lendingPool.getUserAccountData(user);
        List<AccountResponse.PositionEntry> positions = lendingPool.getUserPositions(user).stream()
                .map(p -> new AccountResponse.PositionEntry(p.asset(), p.kind(), p.balance(), p.collateralEnabled()))
                .toList();
        return ResponseEntity.ok(new AccountResponse(user, account.collateralValue(), account.debtValue(),
                account.healthFactor(), account.availableToBorrow(), positions));
    }

    @GetMapping("/{user}/health-factor")
    public ResponseEntity<HealthFactorResponse> getHealthFactor(@PathVariable String user) {
        BigDecimal healthFactor = lendingPool.getUserHealthFactor(user);
        boolean liquidatable = healthFactor.compareTo(BigDecimal.ONE) < 0;
        return ResponseEntity.ok(new HealthFactorResponse(user, healthFactor, liquidatable));
    }
}
