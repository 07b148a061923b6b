package com.cointax.pricing;

import com.cointax.domain.CoinAmount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Values coin amounts as unit price × amount × proportion, with unit prices from the historical
 * price resolver chain.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PriceDataCostLookup implements CostBasisLookup {

    private final HistoricalPriceResolver historicalPriceResolver;

    @Override
    public BigDecimal partialCost(CoinAmount amount, BigDecimal proportion) {
        if (proportion.signum() <= 0 || proportion.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Proportion must be in (0, 1], got: " + proportion);
        }
        HistoricalPriceRequest request = HistoricalPriceRequest.of(amount);
        PriceResolutionResult result = historicalPriceResolver.resolve(request);
        BigDecimal price = result.getPrice()
                .orElseThrow(() -> new PriceUnavailableException("No price for " + request));
        log.debug("Priced {} at {} ({}, quoted {} earlier)", request, price, result.getPriceSource(),
                result.ageAt(request.getUtcTime()).orElse(Duration.ZERO));
        return price.multiply(amount.getChange()).multiply(proportion);
    }
}
