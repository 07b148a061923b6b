package com.cointax.costbasis.rule;

import com.cointax.costbasis.exception.UnsupportedCountryException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Taxation rules by country. Unknown countries fail when the rule is requested, before any
 * operation is evaluated.
 */
@Component
public class TaxationRuleRegistry {

    private final Map<String, TaxationRule> rules = new TreeMap<>();

    public TaxationRuleRegistry(List<TaxationRule> rules) {
        for (TaxationRule rule : rules) {
            TaxationRule previous = this.rules.put(normalize(rule.country()), rule);
            if (previous != null) {
                throw new IllegalStateException("Duplicate taxation rule for " + rule.country());
            }
        }
    }

    public TaxationRule forCountry(String country) {
        if (country == null || country.isBlank()) {
            throw new UnsupportedCountryException("No country configured");
        }
        TaxationRule rule = rules.get(normalize(country));
        if (rule == null) {
            throw new UnsupportedCountryException("Unable to evaluate taxation for country " + country
                    + "; supported: " + rules.keySet());
        }
        return rule;
    }

    private static String normalize(String country) {
        return country.strip().toUpperCase(Locale.ROOT);
    }
}
