package com.cointax.costbasis.queue;

import com.cointax.domain.Operation;

import java.math.BigDecimal;

/**
 * Acquisition lot: the operation that added coins and how many of them are still held.
 * Owned by exactly one {@link BalanceQueue}, which is the only writer of {@code remaining}.
 */
public final class Lot {

    private final Operation op;
    private BigDecimal remaining;

    Lot(Operation op) {
        this.op = op;
        this.remaining = op.getChange();
    }

    public Operation getOp() {
        return op;
    }

    public BigDecimal getRemaining() {
        return remaining;
    }

    void take(BigDecimal amount) {
        remaining = remaining.subtract(amount);
    }
}
