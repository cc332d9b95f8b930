package com.lendpool.pool;

import java.math.BigDecimal;

/**
 * USD values at WAD precision.
 */
public record UserAccountData(
        String user,
        BigDecimal collateralValue,
        BigDecimal debtValue,
        BigDecimal healthFactor,
        BigDecimal availableToBorrow
) {
}
