package com.lendpool.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.lendpool.pricing.CoinGeckoPriceOracle;
import com.lendpool.pricing.config.PricingProperties;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String PRICE_QUOTE_CACHE = CoinGeckoPriceOracle.PRICE_QUOTE_CACHE;

    @Bean
    public CacheManager caffeineCacheManager(PricingProperties pricingProperties) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(PRICE_QUOTE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(pricingProperties.getCacheTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(500)
                .build());
        return manager;
    }
}
