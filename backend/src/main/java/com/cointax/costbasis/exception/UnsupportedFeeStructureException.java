package com.cointax.costbasis.exception;

import com.cointax.common.CoinTaxException;

/**
 * A disposal declares more than two fees.
 */
public class UnsupportedFeeStructureException extends CoinTaxException {

    public UnsupportedFeeStructureException(String message) {
        super("UNSUPPORTED_FEE_STRUCTURE", message);
    }
}
