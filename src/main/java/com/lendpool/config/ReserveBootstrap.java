package com.lendpool.config;

import com.lendpool.common.LendingException;
import com.lendpool.domain.LiquidationConfig;
import com.lendpool.pool.PoolAdminService;
import com.lendpool.pool.config.LendPoolProperties;
import com.lendpool.pool.config.LendPoolProperties.ReserveProperties;
import com.lendpool.ratemodel.RateConfig;
import com.lendpool.state.ReserveStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Lists the reserves configured under lendpool.reserves at startup. Reserves already listed are skipped; an invalid
 * reserve definition fails startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReserveBootstrap implements ApplicationRunner {

    private final PoolAdminService poolAdminService;
    private final ReserveStore reserveStore;
    private final LendPoolProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        int listed = 0;
        for (ReserveProperties reserve : properties.getReserves()) {
            if (reserve.getAsset() != null && reserveStore.contains(reserve.getAsset())) {
                log.debug("Reserve {} already listed", reserve.getAsset());
                continue;
            }
            try {
                poolAdminService.initReserve(properties.getAdminAddress(), reserve.getAsset(), reserve.getRateModel(),
                        rateConfig(reserve), liquidationConfig(reserve));
                if (!reserve.isBorrowingEnabled()) {
                    poolAdminService.setBorrowingEnabled(properties.getAdminAddress(), reserve.getAsset(), false);
                }
                listed++;
            } catch (LendingException e) {
                throw new IllegalStateException("Invalid reserve configuration for " + reserve.getAsset()
                        + ": " + e.getMessage(), e);
            }
        }
        log.info("Reserve bootstrap complete: {} reserve(s) listed", listed);
    }

    private RateConfig rateConfig(ReserveProperties reserve) {
        return RateConfig.fromAnnual(reserve.getBaseRateApr(), reserve.getOptimalUtilization(),
                reserve.getSlope1Apr(), reserve.getSlope2Apr(), reserve.getReserveFactor(),
                properties.getSecondsPerYear());
    }

    private static LiquidationConfig liquidationConfig(ReserveProperties reserve) {
        return new LiquidationConfig(reserve.getCollateralFactor(), reserve.getLiquidationThreshold(),
                reserve.getLiquidationBonus(), reserve.getCloseFactor());
    }
}
