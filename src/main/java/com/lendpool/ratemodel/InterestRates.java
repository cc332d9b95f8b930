package com.lendpool.ratemodel;

import java.math.BigDecimal;

/**
 * Rates for one utilization point. All three values are at RAY precision.
 */
public record InterestRates(BigDecimal utilization, BigDecimal borrowRate, BigDecimal supplyRate) {
}
