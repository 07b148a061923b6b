package com.cointax.pricing;

/**
 * Resolves the historical fiat unit price of a coin. Chain: Fiat → PriceTable → UNKNOWN.
 */
public interface HistoricalPriceResolver {

    /**
     * Resolve the unit price for the request. Returns UNKNOWN when all resolvers in the chain fail.
     */
    PriceResolutionResult resolve(HistoricalPriceRequest request);
}
