package com.cointax.costbasis.exception;

import com.cointax.common.CoinTaxException;

import java.math.BigDecimal;

/**
 * More coins are disposed of than were ever recorded as acquired for a balance key.
 * Indicates an incomplete or inconsistent ledger.
 */
public class InsufficientBalanceException extends CoinTaxException {

    public InsufficientBalanceException(String coin, BigDecimal requested, BigDecimal available, String context) {
        super("INSUFFICIENT_BALANCE", "Not enough " + coin + " to remove " + requested.toPlainString()
                + " (available " + available.toPlainString() + ")" + (context == null ? "" : ": " + context));
    }
}
