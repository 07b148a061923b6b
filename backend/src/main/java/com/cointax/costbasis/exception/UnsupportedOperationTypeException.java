package com.cointax.costbasis.exception;

import com.cointax.common.CoinTaxException;

/**
 * The state machine has no transition for an operation.
 */
public class UnsupportedOperationTypeException extends CoinTaxException {

    public UnsupportedOperationTypeException(String message) {
        super("UNSUPPORTED_OPERATION", message);
    }
}
