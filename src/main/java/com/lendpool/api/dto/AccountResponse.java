package com.lendpool.api.dto;

import com.lendpool.domain.PositionKind;

import java.math.BigDecimal;
import java.util.List;

/**
 * GET /api/v1/accounts/{user} response. USD values at WAD precision.
 */
public record AccountResponse(
        String user,
        BigDecimal collateralValue,
        BigDecimal debtValue,
        BigDecimal healthFactor,
        BigDecimal availableToBorrow,
        List<PositionEntry> positions
) {

    public record PositionEntry(String asset, PositionKind kind, BigDecimal balance, boolean collateralEnabled) {
    }
}
