package com.lendpool.liquidation;

import java.math.BigDecimal;

/**
 * Published after a liquidation commits. Consumed for observability only.
 */
public record LiquidationRecord(
        String liquidator,
        String borrower,
        String debtAsset,
        String collateralAsset,
        BigDecimal actualRepaid,
        BigDecimal collateralSeized,
        BigDecimal healthFactorBefore,
        BigDecimal healthFactorAfter,
        long timestamp
) {

    public static LiquidationRecord of(String liquidator, String borrower, String debtAsset, String collateralAsset,
                                       LiquidationResult result, long timestamp) {
        return new LiquidationRecord(liquidator, borrower, debtAsset, collateralAsset,
                result.actualRepaid(), result.collateralSeized(),
                result.healthFactorBefore(), result.healthFactorAfter(), timestamp);
    }
}
