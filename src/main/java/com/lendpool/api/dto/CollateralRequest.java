package com.lendpool.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/pool/collateral request body.
 */
public record CollateralRequest(
        @NotBlank(message = "INVALID_REQUEST")
        String user,

        @NotBlank(message = "INVALID_REQUEST")
        String asset,

        @NotNull(message = "INVALID_REQUEST")
        Boolean enabled
) {
}
