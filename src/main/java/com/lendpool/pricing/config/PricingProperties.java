package com.lendpool.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Pricing configuration. Documented in application.yml under lendpool.pricing.
 */
@ConfigurationProperties(prefix = "lendpool.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * Price source: "fixed" (in-memory, settable) or "coingecko".
     */
    private String source = "fixed";

    /**
     * Quotes older than this many seconds abort the operation that needs them.
     */
    private long maxPriceAgeSeconds = 3600;

    /**
     * Maximum accepted confidence / price ratio (0.02 = quote may be off by at most 2%).
     */
    private BigDecimal maxConfidenceRatio = new BigDecimal("0.02");

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * Map: asset id (e.g. "ETH") -> CoinGecko coin id (e.g. "ethereum").
     */
    private Map<String, String> assetToCoinGeckoId = new HashMap<>();

    /**
     * TTL in seconds for cached CoinGecko quotes. Keep well below maxPriceAgeSeconds.
     */
    private int cacheTtlSeconds = 60;

    /**
     * Seed prices (USD) for the fixed source. Seeded assets are pinned: their quotes are always stamped "now".
     */
    private Map<String, BigDecimal> fixedPrices = new HashMap<>();
}
