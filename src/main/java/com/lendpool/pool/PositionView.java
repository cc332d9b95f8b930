package com.lendpool.pool;

import com.lendpool.domain.PositionKind;

import java.math.BigDecimal;

public record PositionView(
        String asset,
        PositionKind kind,
        BigDecimal balance,
        boolean collateralEnabled
) {
}
