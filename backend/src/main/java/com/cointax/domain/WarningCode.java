package com.cointax.domain;

/**
 * Data-quality condition that did not abort the evaluation but makes a figure uncertain.
 */
public enum WarningCode {
    /** Sold coins came from a deposit without a linked withdrawal; deposit time used as acquisition. */
    MISSING_DEPOSIT_LINK,
    /** Linked withdrawal has no recorded lots; deposit time used as acquisition. */
    UNLINKED_WITHDRAWAL_LOTS,
    /** No price for an unrealized valuation at the deadline; sell value set to zero. */
    UNREALIZED_PRICE_UNKNOWN,
    /** Withdrawal/deposit fees are computed but not deducted from the gain. */
    TRANSFER_FEE_EXCLUDED,
    /** Lent coins are not marked unavailable and do not extend the holding period. */
    LENDING_NOT_TRACKED,
    /** Staked coins are not marked unavailable and do not extend the holding period. */
    STAKING_NOT_TRACKED
}
