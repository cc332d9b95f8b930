package com.lendpool.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record LiquidationRequest(
        @NotBlank(message = "INVALID_REQUEST")
        String liquidator,

        @NotBlank(message = "INVALID_REQUEST")
        String borrower,

        @NotBlank(message = "INVALID_REQUEST")
        String debtAsset,

        @NotBlank(message = "INVALID_REQUEST")
        String collateralAsset,

        @NotNull(message = "INVALID_AMOUNT")
        BigDecimal repayAmount
) {
}
