package com.lendpool.pool;

import java.math.BigDecimal;

/**
 * Reserve view projected to the time of the query. Amounts, utilization and APRs at WAD precision; indices and
 * per-second rates at RAY precision.
 */
public record ReserveData(
        String asset,
        BigDecimal totalDeposits,
        BigDecimal totalBorrows,
        BigDecimal availableLiquidity,
        BigDecimal accruedToTreasury,
        BigDecimal utilization,
        BigDecimal borrowRate,
        BigDecimal supplyRate,
        BigDecimal borrowApr,
        BigDecimal supplyApr,
        BigDecimal borrowIndex,
        BigDecimal supplyIndex,
        long lastUpdateTimestamp,
        boolean borrowingEnabled,
        boolean active
) {
}
