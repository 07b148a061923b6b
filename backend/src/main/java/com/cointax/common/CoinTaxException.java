package com.cointax.common;

import lombok.Getter;

/**
 * Root of all fatal evaluation errors. A thrown CoinTaxException aborts the whole run;
 * no partial report is returned to the caller.
 */
@Getter
public class CoinTaxException extends RuntimeException {

    /** Stable error code, e.g. INSUFFICIENT_BALANCE, PRICE_UNAVAILABLE. */
    private final String errorCode;

    public CoinTaxException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CoinTaxException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
