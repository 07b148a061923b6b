package com.cointax.domain;

/**
 * Order in which disposals consume acquisition lots.
 */
public enum AccountingPrinciple {
    /** Oldest lot first. */
    FIFO,
    /** Newest lot first. */
    LIFO
}
