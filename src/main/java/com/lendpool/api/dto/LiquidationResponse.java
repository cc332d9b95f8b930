package com.lendpool.api.dto;

import java.math.BigDecimal;

public record LiquidationResponse(
        String borrower,
        BigDecimal actualRepaid,
        BigDecimal collateralSeized,
        BigDecimal healthFactorBefore,
        BigDecimal healthFactorAfter
) {
}
