package com.cointax.costbasis.exception;

import com.cointax.common.CoinTaxException;

/**
 * A lot carries a negative remaining amount. Internal invariant breach.
 */
public class NegativeBalanceException extends CoinTaxException {

    public NegativeBalanceException(String message) {
        super("NEGATIVE_BALANCE", message);
    }
}
