package com.lendpool.pool;

import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.domain.LiquidationConfig;
import com.lendpool.domain.Reserve;
import com.lendpool.pool.config.LendPoolProperties;
import com.lendpool.ratemodel.RateConfig;
import com.lendpool.ratemodel.RateModel;
import com.lendpool.state.PoolTransaction;
import com.lendpool.state.WorldState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

/**
 * Reserve listing and risk-parameter changes. Only lendpool.admin-address may call these.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolAdminService {

    private final WorldState worldState;
    private final LendPoolProperties properties;
    private final Clock clock;

    public void initReserve(String caller, String asset, RateModel rateModel, RateConfig rateConfig,
                            LiquidationConfig liquidationConfig) {
        authorize(caller);
        if (asset == null || asset.isBlank()) {
            throw new LendingException(LendingError.INVALID_CONFIG, "asset is required");
        }
        validate(rateModel, rateConfig);
        validate(liquidationConfig);

        PoolTransaction tx = worldState.begin(now());
        tx.listReserve(Reserve.create(asset, rateModel, rateConfig, liquidationConfig, tx.getNow()));
        tx.commit();
        log.info("Listed reserve {} ({} rate model)", asset, rateModel);
    }

    /**
     * Interest up to now accrues at the old rates before the new curve applies.
     */
    public void updateRateConfig(String caller, String asset, RateModel rateModel, RateConfig rateConfig) {
        authorize(caller);
        validate(rateModel, rateConfig);

        PoolTransaction tx = worldState.begin(now());
        Reserve reserve = tx.reserveForUpdate(asset);
        reserve.setRateModel(rateModel);
        reserve.setRateConfig(rateConfig);
        tx.commit();
        log.info("Updated rate config of {}: {} {}", asset, rateModel, rateConfig);
    }

    public void updateLiquidationConfig(String caller, String asset, LiquidationConfig liquidationConfig) {
        authorize(caller);
        validate(liquidationConfig);

        PoolTransaction tx = worldState.begin(now());
        tx.reserveForUpdate(asset).setLiquidationConfig(liquidationConfig);
        tx.commit();
        log.info("Updated liquidation config of {}: {}", asset, liquidationConfig);
    }

    public void setBorrowingEnabled(String caller, String asset, boolean enabled) {
        authorize(caller);
        PoolTransaction tx = worldState.begin(now());
        tx.reserveForUpdate(asset).setBorrowingEnabled(enabled);
        tx.commit();
        log.info("Borrowing {} for {}", enabled ? "enabled" : "disabled", asset);
    }

    public void setReserveActive(String caller, String asset, boolean active) {
        authorize(caller);
        PoolTransaction tx = worldState.begin(now());
        tx.reserveForUpdate(asset).setActive(active);
        tx.commit();
        log.info("Reserve {} {}", asset, active ? "activated" : "deactivated");
    }

    private void authorize(String caller) {
        if (!Objects.equals(caller, properties.getAdminAddress())) {
            log.warn("Rejected admin call from {}", caller);
            throw new LendingException(LendingError.UNAUTHORIZED, "Caller is not the pool admin: " + caller);
        }
    }

    private static void validate(RateModel rateModel, RateConfig rateConfig) {
        if (rateModel == null || rateConfig == null) {
            throw new LendingException(LendingError.INVALID_CONFIG, "rate model and rate config are required");
        }
        rateConfig.validate();
    }

    private static void validate(LiquidationConfig liquidationConfig) {
        if (liquidationConfig == null) {
            throw new LendingException(LendingError.INVALID_CONFIG, "liquidation config is required");
        }
        liquidationConfig.validate();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
