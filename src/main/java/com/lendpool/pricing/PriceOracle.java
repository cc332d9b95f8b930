package com.lendpool.pricing;

/**
 * External price capability consumed by the health-factor calculation. Freshness and confidence are checked by
 * the caller against its own limits.
 */
public interface PriceOracle {

    /**
     * Latest quote for the asset.
     *
     * @throws com.lendpool.common.LendingException PRICE_UNAVAILABLE when no quote can be produced
     */
    PriceQuote getPrice(String asset);
}
