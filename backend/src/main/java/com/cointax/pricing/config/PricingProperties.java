package com.cointax.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Pricing module configuration. Documented in application.yml under cointax.pricing.
 */
@ConfigurationProperties(prefix = "cointax.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * JSON price table: array of {platform, coin, utcTime, price}. A quote without platform applies
     * to every platform. When unset, only the reporting fiat can be priced.
     */
    private String priceFile;

    /**
     * Maximum age of the latest quote before the requested timestamp.
     */
    private Duration maxPriceAge = Duration.ofDays(1);

    /**
     * TTL in minutes of the parsed price table; the file is re-read afterwards.
     */
    private int priceTableCacheTtlMinutes = 60;
}
