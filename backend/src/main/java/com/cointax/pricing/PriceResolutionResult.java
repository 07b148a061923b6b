package com.cointax.pricing;

import com.cointax.domain.PriceSource;
import com.cointax.pricing.resolver.PriceQuote;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of one resolver in the chain: a fiat unit price, where it came from and the instant it was
 * quoted at, or UNKNOWN so the next resolver is asked.
 */
public final class PriceResolutionResult {

    private static final PriceResolutionResult UNKNOWN = new PriceResolutionResult(null, PriceSource.UNKNOWN, null);

    private final BigDecimal price;
    @Getter
    private final PriceSource priceSource;
    private final Instant quotedAt;

    private PriceResolutionResult(BigDecimal price, PriceSource priceSource, Instant quotedAt) {
        this.price = price;
        this.priceSource = priceSource;
        this.quotedAt = quotedAt;
    }

    public static PriceResolutionResult known(BigDecimal price, PriceSource source, Instant quotedAt) {
        if (price == null || quotedAt == null || source == null || source == PriceSource.UNKNOWN) {
            return UNKNOWN;
        }
        return new PriceResolutionResult(price, source, quotedAt);
    }

    public static PriceResolutionResult fromQuote(PriceQuote quote) {
        return known(quote.price(), PriceSource.PRICE_TABLE, quote.utcTime());
    }

    public static PriceResolutionResult unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }

    public Optional<BigDecimal> getPrice() {
        return Optional.ofNullable(price);
    }

    public Optional<Instant> getQuotedAt() {
        return Optional.ofNullable(quotedAt);
    }

    /**
     * How long before {@code time} the price was quoted; empty when unknown.
     */
    public Optional<Duration> ageAt(Instant time) {
        return getQuotedAt().map(at -> Duration.between(at, time));
    }
}
