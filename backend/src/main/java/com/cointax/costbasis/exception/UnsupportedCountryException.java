package com.cointax.costbasis.exception;

import com.cointax.common.CoinTaxException;

/**
 * No taxation rule is registered for the configured country.
 */
public class UnsupportedCountryException extends CoinTaxException {

    public UnsupportedCountryException(String message) {
        super("UNSUPPORTED_COUNTRY", message);
    }
}
