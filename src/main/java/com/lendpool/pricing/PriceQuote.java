package com.lendpool.pricing;

import java.math.BigDecimal;

/**
 * USD price of an asset as reported by an oracle.
 *
 * @param price      USD per whole token (WAD)
 * @param timestamp  epoch seconds at which the price was observed
 * @param confidence absolute confidence interval in USD; zero when the source does not report one
 */
public record PriceQuote(BigDecimal price, long timestamp, BigDecimal confidence) {

    public static PriceQuote of(BigDecimal price, long timestamp) {
        return new PriceQuote(price, timestamp, BigDecimal.ZERO);
    }

    public BigDecimal confidenceOrZero() {
        return confidence != null ? confidence : BigDecimal.ZERO;
    }
}
