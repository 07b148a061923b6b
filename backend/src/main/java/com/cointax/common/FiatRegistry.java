package com.cointax.common;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of coin symbols treated as fiat currencies (EUR, USD, ...).
 * Used to tell capital income (interest paid in fiat) from crypto income.
 */
public class FiatRegistry {

    private final String reportingFiat;
    private final Set<String> fiatCurrencies;

    public FiatRegistry(String reportingFiat, Set<String> fiatCurrencies) {
        this.reportingFiat = normalize(reportingFiat);
        this.fiatCurrencies = fiatCurrencies.stream()
                .map(FiatRegistry::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    /** Returns true if the given symbol (any case) is a known fiat currency or the reporting fiat. */
    public boolean isFiat(String coin) {
        if (coin == null || coin.isBlank()) {
            return false;
        }
        String symbol = normalize(coin);
        return symbol.equals(reportingFiat) || fiatCurrencies.contains(symbol);
    }

    /** Returns true if the symbol is the currency all values are reported in. */
    public boolean isReportingFiat(String coin) {
        return coin != null && normalize(coin).equals(reportingFiat);
    }

    public String getReportingFiat() {
        return reportingFiat;
    }

    private static String normalize(String symbol) {
        return symbol.strip().toUpperCase(Locale.ROOT);
    }
}
