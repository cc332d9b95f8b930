package com.lendpool.domain;

import com.lendpool.common.FixedPoint;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Per-reserve risk parameters, all fractions (0.75 = 75%).
 * collateralFactor weighs the asset's collateral power in the health factor; closeFactor caps the share of a
 * single debt position one liquidation may repay; liquidationBonus is the extra collateral paid to liquidators.
 */
public record LiquidationConfig(
        BigDecimal collateralFactor,
        BigDecimal liquidationThreshold,
        BigDecimal liquidationBonus,
        BigDecimal closeFactor
) {

    public LiquidationConfig {
        Objects.requireNonNull(collateralFactor, "collateralFactor");
        Objects.requireNonNull(liquidationThreshold, "liquidationThreshold");
        Objects.requireNonNull(liquidationBonus, "liquidationBonus");
        Objects.requireNonNull(closeFactor, "closeFactor");
    }

    public void validate() {
        if (!FixedPoint.isFraction(collateralFactor)) {
            throw new LendingException(LendingError.INVALID_CONFIG, "collateralFactor must be within [0, 1]");
        }
        if (!FixedPoint.isFraction(liquidationThreshold)) {
            throw new LendingException(LendingError.INVALID_CONFIG, "liquidationThreshold must be within [0, 1]");
        }
        if (liquidationThreshold.compareTo(collateralFactor) < 0) {
            throw new LendingException(LendingError.INVALID_CONFIG,
                    "liquidationThreshold " + liquidationThreshold + " is below collateralFactor " + collateralFactor);
        }
        if (liquidationBonus.signum() < 0) {
            throw new LendingException(LendingError.INVALID_CONFIG, "liquidationBonus must not be negative");
        }
        if (!FixedPoint.isPositive(closeFactor) || closeFactor.compareTo(BigDecimal.ONE) > 0) {
            throw new LendingException(LendingError.INVALID_CONFIG, "closeFactor must be within (0, 1]");
        }
    }
}
