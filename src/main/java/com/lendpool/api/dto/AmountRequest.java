package com.lendpool.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * POST /api/v1/pool/{deposit|withdraw|borrow|repay} request body.
 * amount is in token units; -1 on withdraw and repay means the entire balance.
 */
public record AmountRequest(
        @NotBlank(message = "INVALID_REQUEST")
        String user,

        @NotBlank(message = "INVALID_REQUEST")
        String asset,

        @NotNull(message = "INVALID_AMOUNT")
        BigDecimal amount
) {
}
