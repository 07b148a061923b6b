package com.cointax.pricing.resolver;

import com.cointax.common.FiatRegistry;
import com.cointax.domain.PriceSource;
import com.cointax.pricing.HistoricalPriceRequest;
import com.cointax.pricing.PriceResolutionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Resolves the reporting fiat currency to 1.
 */
@Component
@RequiredArgsConstructor
public class FiatResolver {

    private final FiatRegistry fiatRegistry;

    /**
     * Returns FIAT 1 if the coin is the reporting fiat, otherwise UNKNOWN (next resolver).
     */
    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        if (request == null || request.getCoin() == null || request.getUtcTime() == null) {
            return PriceResolutionResult.unknown();
        }
        if (fiatRegistry.isReportingFiat(request.getCoin())) {
            return PriceResolutionResult.known(BigDecimal.ONE, PriceSource.FIAT, request.getUtcTime());
        }
        return PriceResolutionResult.unknown();
    }
}
