package com.lendpool.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendpool.common.FixedPoint;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Optional;

/**
 * Spot USD quotes from CoinGecko /simple/price with last_updated_at as the quote timestamp.
 * Quotes are cached in priceQuoteCache (TTL lendpool.pricing.cache-ttl-seconds); failures are not cached.
 */
@Component
@ConditionalOnProperty(prefix = "lendpool.pricing", name = "source", havingValue = "coingecko")
@RequiredArgsConstructor
@Slf4j
public class CoinGeckoPriceOracle implements PriceOracle {

    public static final String PRICE_QUOTE_CACHE = "priceQuoteCache";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;

    @Override
    @Cacheable(cacheNames = PRICE_QUOTE_CACHE, key = "#asset")
    public PriceQuote getPrice(String asset) {
        if (asset == null || asset.isBlank()) {
            throw new LendingException(LendingError.PRICE_UNAVAILABLE, "Asset id is required");
        }
        String coinId = pricingProperties.getAssetToCoinGeckoId().get(asset);
        if (coinId == null || coinId.isBlank()) {
            throw new LendingException(LendingError.PRICE_UNAVAILABLE, "No CoinGecko id configured for " + asset);
        }
        String url = pricingProperties.getCoingeckoBaseUrl()
                + "/simple/price?ids=" + coinId + "&vs_currencies=usd&include_last_updated_at=true";
        String response;
        try {
            response = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            log.warn("CoinGecko price request failed for {} ({}): {}", asset, coinId, e.getStatusCode());
            throw new LendingException(LendingError.PRICE_UNAVAILABLE, "CoinGecko request failed for " + asset, e);
        } catch (RuntimeException e) {
            log.warn("CoinGecko price request error for {} ({})", asset, coinId, e);
            throw new LendingException(LendingError.PRICE_UNAVAILABLE, "CoinGecko request failed for " + asset, e);
        }
        return parseQuote(response, coinId)
                .orElseThrow(() -> new LendingException(LendingError.PRICE_UNAVAILABLE,
                        "CoinGecko returned no usable quote for " + asset));
    }

    /**
     * Parses {"coinId": {"usd": 2000.5, "last_updated_at": 1700000000}}.
     */
    static Optional<PriceQuote> parseQuote(String json, String coinId) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode coin = MAPPER.readTree(json).path(coinId);
            JsonNode usd = coin.path("usd");
            JsonNode updatedAt = coin.path("last_updated_at");
            if (!usd.isNumber() || !updatedAt.canConvertToLong()) {
                return Optional.empty();
            }
            return Optional.of(PriceQuote.of(FixedPoint.wad(usd.decimalValue()), updatedAt.asLong()));
        } catch (Exception e) {
            log.debug("Unparseable CoinGecko response for {}", coinId, e);
            return Optional.empty();
        }
    }
}
