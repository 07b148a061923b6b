package com.cointax.domain.report;

/**
 * Kind of a tax report entry; renderers group entries by this type.
 */
public enum ReportEntryType {
    SELL,
    UNREALIZED_SELL,
    INTEREST,
    LENDING_INTEREST,
    STAKING_INTEREST,
    AIRDROP,
    COMMISSION,
    TRANSFER
}
