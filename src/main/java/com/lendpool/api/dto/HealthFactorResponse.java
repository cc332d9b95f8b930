package com.lendpool.api.dto;

import java.math.BigDecimal;

/**
 * healthFactor at WAD precision; (2^256 - 1) / 1e18 when the user has no debt.
 */
public record HealthFactorResponse(String user, BigDecimal healthFactor, boolean liquidatable) {
}
