package com.cointax.pricing;

import com.cointax.pricing.resolver.FiatResolver;
import com.cointax.pricing.resolver.PriceTableResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Chain: Fiat → PriceTable → UNKNOWN.
 */
@Component
@RequiredArgsConstructor
public class HistoricalPriceResolverChain implements HistoricalPriceResolver {

    private final FiatResolver fiatResolver;
    private final PriceTableResolver priceTableResolver;

    @Override
    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        PriceResolutionResult r = fiatResolver.resolve(request);
        if (!r.isUnknown()) {
            return r;
        }
        return priceTableResolver.resolve(request);
    }
}
