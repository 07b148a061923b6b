package com.cointax.pricing;

import com.cointax.common.CoinTaxException;

/**
 * No fiat price is known for a coin on a platform at a point in time.
 */
public class PriceUnavailableException extends CoinTaxException {

    public PriceUnavailableException(String message) {
        super("PRICE_UNAVAILABLE", message);
    }
}
