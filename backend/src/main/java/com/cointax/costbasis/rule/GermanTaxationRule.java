package com.cointax.costbasis.rule;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Germany: private sales of crypto assets are "Sonstige Einkünfte" and tax exempt after a
 * holding period of more than one year (§ 23 EStG). Staking, lending and referral income is
 * "Einkünfte aus sonstigen Leistungen", interest in fiat is "Einkünfte aus Kapitalvermögen".
 */
@Component
public class GermanTaxationRule implements TaxationRule {

    public static final String COUNTRY = "GERMANY";

    static final String OTHER_INCOME = "Sonstige Einkünfte";
    static final String CAPITAL_INCOME = "Einkünfte aus Kapitalvermögen";
    static final String MISC_SERVICES_INCOME = "Einkünfte aus sonstigen Leistungen";
    static final String GIFT = "Schenkung";

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    @Override
    public String country() {
        return COUNTRY;
    }

    /**
     * Taxable unless held longer than one year: acquired + 1 year must be before the disposal.
     */
    @Override
    public boolean isTaxable(Instant acquired, Instant disposed) {
        ZonedDateTime oneYearLater = acquired.atZone(BERLIN).plusYears(1);
        return !oneYearLater.toInstant().isBefore(disposed);
    }

    @Override
    public String sellTaxationType() {
        return OTHER_INCOME;
    }

    @Override
    public String interestTaxationType(boolean fiatCoin) {
        return fiatCoin ? CAPITAL_INCOME : MISC_SERVICES_INCOME;
    }

    @Override
    public String airdropTaxationType(boolean gift) {
        return gift ? GIFT : MISC_SERVICES_INCOME;
    }

    @Override
    public boolean isAirdropTaxable(boolean gift) {
        return !gift;
    }

    @Override
    public String commissionTaxationType() {
        return MISC_SERVICES_INCOME;
    }
}
