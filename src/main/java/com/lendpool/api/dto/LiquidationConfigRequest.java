package com.lendpool.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record LiquidationConfigRequest(
        @NotNull(message = "INVALID_CONFIG")
        BigDecimal collateralFactor,

        @NotNull(message = "INVALID_CONFIG")
        BigDecimal liquidationThreshold,

        @NotNull(message = "INVALID_CONFIG")
        BigDecimal liquidationBonus,

        @NotNull(message = "INVALID_CONFIG")
        BigDecimal closeFactor
) {
}
