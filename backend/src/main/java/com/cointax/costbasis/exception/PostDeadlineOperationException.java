package com.cointax.costbasis.exception;

import com.cointax.common.CoinTaxException;

/**
 * The ledger contains an operation after the end of the evaluated tax year.
 */
public class PostDeadlineOperationException extends CoinTaxException {

    public PostDeadlineOperationException(String message) {
        super("POST_DEADLINE_OPERATION", message);
    }
}
