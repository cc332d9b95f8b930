package com.lendpool.api.dto;

import com.lendpool.ratemodel.RateModel;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * Yearly rates as fractions (0.04 = 4% APR); converted to per-second rates on receipt.
 */
public record RateConfigRequest(
        @NotNull(message = "INVALID_CONFIG")
        RateModel rateModel,

        @NotNull(message = "INVALID_CONFIG")
        BigDecimal baseRateApr,

        @NotNull(message = "INVALID_CONFIG")
        BigDecimal optimalUtilization,

        @NotNull(message = "INVALID_CONFIG")
        BigDecimal slope1Apr,

        @NotNull(message = "INVALID_CONFIG")
        BigDecimal slope2Apr,

        @NotNull(message = "INVALID_CONFIG")
        BigDecimal reserveFactor
) {
}
