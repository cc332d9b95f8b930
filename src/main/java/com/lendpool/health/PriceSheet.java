package com.lendpool.health;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Validated prices for one operation. Each asset is quoted and checked once, so every step of an operation
 * sees the same price.
 */
public final class PriceSheet {

    private final Function<String, BigDecimal> source;
    private final Map<String, BigDecimal> prices = new HashMap<>();

    PriceSheet(Function<String, BigDecimal> source) {
        this.source = source;
    }

    public BigDecimal price(String asset) {
        BigDecimal cached = prices.get(asset);
        if (cached != null) {
            return cached;
        }
        BigDecimal price = source.apply(asset);
        prices.put(asset, price);
        return price;
    }
}
