package com.cointax.costbasis.rule;

import java.time.Instant;

/**
 * Country-specific classification of tax events. One implementation per supported jurisdiction,
 * selected once when the engine is built.
 */
public interface TaxationRule {

    /** Country name this rule is registered under, e.g. GERMANY. */
    String country();

    /** Whether the gain of coins acquired at {@code acquired} and disposed of at {@code disposed} is taxable. */
    boolean isTaxable(Instant acquired, Instant disposed);

    /** Category of gains from selling coins. */
    String sellTaxationType();

    /** Category of interest; {@code fiatCoin} is true when the interest is paid in a fiat currency. */
    String interestTaxationType(boolean fiatCoin);

    /** Category of airdrops; {@code gift} is true when airdrops are configured to count as gifts. */
    String airdropTaxationType(boolean gift);

    /** Whether an airdrop of the given category is taxable income. */
    boolean isAirdropTaxable(boolean gift);

    String commissionTaxationType();
}
