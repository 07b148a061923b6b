package com.cointax.config;

import com.cointax.domain.AccountingPrinciple;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tax evaluation config. Documented in application.yml under cointax.
 */
@ConfigurationProperties(prefix = "cointax")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class TaxProperties {

    /** Evaluated calendar year. */
    @Min(2009)
    private int taxYear;

    /** Currency all values are reported in. */
    @NotBlank
    private String fiat = "EUR";

    /** Coins treated as fiat when classifying interest. */
    private Set<String> fiatCurrencies = new LinkedHashSet<>(Set.of("EUR", "USD", "GBP", "CHF"));

    /** Order in which disposals consume lots. */
    @NotNull
    private AccountingPrinciple principle = AccountingPrinciple.FIFO;

    /** Keep one balance per platform and coin instead of one per coin. */
    private boolean multiDepot;

    /** Country whose taxation rule applies. */
    @NotBlank
    private String country = "GERMANY";

    /** Treat every airdrop as a gift instead of income. */
    private boolean allAirdropsAreGifts;

    /** Zone of the taxpayer; decides the year boundary and the deadline. */
    @NotNull
    private ZoneId localTimezone = ZoneId.of("Europe/Berlin");
}
