package com.cointax.domain;

/**
 * Kind of a ledger operation. Every kind is handled by the taxation state machine.
 */
public enum OperationType {
    BUY,
    SELL,
    DEPOSIT,
    WITHDRAWAL,
    COIN_LEND,
    COIN_LEND_END,
    COIN_LEND_INTEREST,
    STAKING,
    STAKING_END,
    STAKING_INTEREST,
    AIRDROP,
    COMMISSION;

    /** Only deposits and withdrawals may reference their counterpart on another platform. */
    public boolean isLinkable() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }
}
