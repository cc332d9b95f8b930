package com.lendpool.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * PUT /api/v1/admin/reserves/{asset} request body.
 */
public record ListReserveRequest(
        @NotNull(message = "INVALID_CONFIG")
        @Valid
        RateConfigRequest rates,

        @NotNull(message = "INVALID_CONFIG")
        @Valid
        LiquidationConfigRequest liquidation
) {
}
