package com.cointax.pricing.config;

import com.cointax.pricing.resolver.PriceTable;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Pricing module configuration: properties and the price table cache.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    public static final String PRICE_TABLE_CACHE = "priceTableCache";

    @Bean(PRICE_TABLE_CACHE)
    public Cache<String, PriceTable> priceTableCache(PricingProperties pricingProperties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(pricingProperties.getPriceTableCacheTtlMinutes(), TimeUnit.MINUTES)
                .maximumSize(1)
                .build();
    }
}
