package com.cointax.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A disposal's match against an acquisition lot: the operation that created the lot and the
 * amount taken from it. {@code amount} never exceeds the lot's remaining amount at match time.
 */
public record ConsumedLot(Operation op, BigDecimal amount) {

    public ConsumedLot {
        Objects.requireNonNull(op, "lot operation must not be null");
        Objects.requireNonNull(amount, "consumed amount must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Consumed amount must not be negative, got: " + amount);
        }
    }

    /** Same lot, amount scaled by {@code factor}. */
    public ConsumedLot partial(BigDecimal factor) {
        return new ConsumedLot(op, amount.multiply(factor));
    }
}
