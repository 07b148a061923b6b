package com.cointax.domain;

/**
 * Where a resolved price came from.
 */
public enum PriceSource {
    /** Coin is the reporting fiat; price is 1. */
    FIAT,
    /** Quote from the configured price table. */
    PRICE_TABLE,
    UNKNOWN
}
