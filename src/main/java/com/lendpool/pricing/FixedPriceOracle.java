package com.lendpool.pricing;

import com.lendpool.common.FixedPoint;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.pricing.config.PricingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Settable in-memory oracle. Prices seeded from lendpool.pricing.fixed-prices or set through {@link #setPrice} are
 * pinned and always quoted with the current time; quotes pushed through {@link #setQuote} keep their own timestamp
 * and can go stale.
 */
@Component
@ConditionalOnProperty(prefix = "lendpool.pricing", name = "source", havingValue = "fixed", matchIfMissing = true)
@Slf4j
public class FixedPriceOracle implements PriceOracle {

    private final Clock clock;
    private final Map<String, PriceQuote> quotes = new ConcurrentHashMap<>();
    private final Set<String> pinned = ConcurrentHashMap.newKeySet();

    public FixedPriceOracle(PricingProperties pricingProperties, Clock clock) {
        this.clock = clock;
        pricingProperties.getFixedPrices().forEach((asset, price) -> {
            quotes.put(asset, PriceQuote.of(FixedPoint.wad(price), now()));
            pinned.add(asset);
        });
    }

    @Override
    public PriceQuote getPrice(String asset) {
        PriceQuote quote = quotes.get(asset);
        if (quote == null) {
            throw new LendingException(LendingError.PRICE_UNAVAILABLE, "No price for " + asset);
        }
        if (pinned.contains(asset)) {
            return new PriceQuote(quote.price(), now(), quote.confidence());
        }
        return quote;
    }

    /**
     * Pin a price; it never goes stale.
     */
    public void setPrice(String asset, BigDecimal price) {
        quotes.put(asset, PriceQuote.of(FixedPoint.wad(price), now()));
        pinned.add(asset);
        log.info("Price for {} pinned at {}", asset, price);
    }

    public void setQuote(String asset, PriceQuote quote) {
        pinned.remove(asset);
        quotes.put(asset, quote);
        log.info("Price for {} set to {} at {}", asset, quote.price(), quote.timestamp());
    }

    public void removePrice(String asset) {
        pinned.remove(asset);
        quotes.remove(asset);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
