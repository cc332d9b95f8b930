package com.lendpool.health;

import com.lendpool.common.FixedPoint;

import java.math.BigDecimal;

/**
 * Derived solvency view of one user, never persisted. Values are USD at WAD precision.
 */
public record HealthSnapshot(
        BigDecimal collateralValue,
        BigDecimal debtValue,
        BigDecimal healthFactor,
        BigDecimal availableToBorrow
) {

    public boolean isHealthy() {
        return healthFactor.compareTo(FixedPoint.WAD_ONE) >= 0;
    }

    public boolean isLiquidatable() {
        return !isHealthy();
    }
}
