package com.lendpool.liquidation;

import java.math.BigDecimal;

/**
 * Outcome of a liquidation, computed on a transaction before commit. Amounts in token units (WAD);
 * health factors at WAD precision.
 */
public record LiquidationResult(
        BigDecimal actualRepaid,
        BigDecimal collateralSeized,
        BigDecimal healthFactorBefore,
        BigDecimal healthFactorAfter
) {
}
