package com.lendpool.api.controller;

import com.lendpool.api.dto.LiquidationConfigRequest;
import com.lendpool.api.dto.ListReserveRequest;
import com.lendpool.api.dto.RateConfigRequest;
import com.lendpool.api.dto.SwitchRequest;
import com.lendpool.domain.LiquidationConfig;
import com.lendpool.pool.PoolAdminService;
import com.lendpool.pool.config.LendPoolProperties;
import com.lendpool.ratemodel.RateConfig;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reserve administration. The caller is taken from the X-Caller header and checked by {@link PoolAdminService}.
 */
@RestController
@RequestMapping("/api/v1/admin/reserves")
@RequiredArgsConstructor
public class AdminController {

    static final String CALLER_HEADER = "X-Caller";

    private final PoolAdminService poolAdminService;
    private final LendPoolProperties properties;

    @PutMapping("/{asset}")
    public ResponseEntity<Void> listReserve(@RequestHeader(CALLER_HEADER) String caller, @PathVariable String asset,
                                            @RequestBody @Valid ListReserveRequest request) {
        poolAdminService.initReserve(caller, asset.trim(), request.rates().rateModel(),
                toRateConfig(request.rates()), toLiquidationConfig(request.liquidation()));
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{asset}/rate-config")
    public ResponseEntity<Void> updateRateConfig(@RequestHeader(CALLER_HEADER) String caller,
                                                 @PathVariable String asset,
                                                 @RequestBody @Valid RateConfigRequest request) {
        poolAdminService.updateRateConfig(caller, asset.trim(), request.rateModel(), toRateConfig(request));
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{asset}/liquidation-config")
    public ResponseEntity<Void> updateLiquidationConfig(@RequestHeader(CALLER_HEADER) String caller,
                                                        @PathVariable String asset,
                                                        @RequestBody @Valid LiquidationConfigRequest request) {
        poolAdminService.updateLiquidationConfig(caller, asset.trim(), toLiquidationConfig(request));
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{asset}/borrowing")
    public ResponseEntity<Void> setBorrowingEnabled(@RequestHeader(CALLER_HEADER) String caller,
                                                    @PathVariable String asset,
                                                    @RequestBody @Valid SwitchRequest request) {
        poolAdminService.setBorrowingEnabled(caller, asset.trim(), request.enabled());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{asset}/active")
    public ResponseEntity<Void> setReserveActive(@RequestHeader(CALLER_HEADER) String caller,
                                                 @PathVariable String asset,
                                                 @RequestBody @Valid SwitchRequest request) {
        poolAdminService.setReserveActive(caller, asset.trim(), request.enabled());
        return ResponseEntity.noContent().build();
    }

    private RateConfig toRateConfig(RateConfigRequest request) {
        return RateConfig.fromAnnual(request.baseRateApr(), request.optimalUtilization(), request.slope1Apr(),
                request.slope2Apr(), request.reserveFactor(), properties.getSecondsPerYear());
    }

    private static LiquidationConfig toLiquidationConfig(LiquidationConfigRequest request) {
        return new LiquidationConfig(request.collateralFactor(), request.liquidationThreshold(),
                request.liquidationBonus(), request.closeFactor());
    }
}
