package com.cointax.pricing.resolver;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row of the price table: fiat price of one coin unit. {@code platform} may be null.
 */
public record PriceQuote(String platform, String coin, Instant utcTime, BigDecimal price) {
}
