package com.cointax.costbasis.rule;

import com.cointax.costbasis.exception.UnsupportedCountryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxationRuleRegistryTest {

    private final TaxationRuleRegistry registry = new TaxationRuleRegistry(List.of(new GermanTaxationRule()));

    @Test
    @DisplayName("finds a rule regardless of case")
    void findsGermany() {
        assertThat(registry.forCountry("germany")).isInstanceOf(GermanTaxationRule.class);
        assertThat(registry.forCountry(" GERMANY ")).isInstanceOf(GermanTaxationRule.class);
    }

    @Test
    @DisplayName("unknown countries fail fast")
    void unknownCountry() {
        assertThatThrownBy(() -> registry.forCountry("AUSTRIA"))
                .isInstanceOf(UnsupportedCountryException.class)
                .hasMessageContaining("AUSTRIA")
                .extracting("errorCode").isEqualTo("UNSUPPORTED_COUNTRY");
    }

    @Test
    @DisplayName("a missing country fails fast")
    void blankCountry() {
        assertThatThrownBy(() -> registry.forCountry(" ")).isInstanceOf(UnsupportedCountryException.class);
        assertThatThrownBy(() -> registry.forCountry(null)).isInstanceOf(UnsupportedCountryException.class);
    }

    @Test
    @DisplayName("two rules for one country are rejected")
    void duplicateRule() {
        assertThatThrownBy(() -> new TaxationRuleRegistry(List.of(new GermanTaxationRule(), new GermanTaxationRule())))
                .isInstanceOf(IllegalStateException.class);
    }
}
