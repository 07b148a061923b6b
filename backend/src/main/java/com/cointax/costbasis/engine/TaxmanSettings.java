package com.cointax.costbasis.engine;

import com.cointax.common.FiatRegistry;
import com.cointax.domain.AccountingPrinciple;
import lombok.Builder;

import java.util.Objects;

/**
 * Per-run engine settings, resolved from configuration before the engine is built.
 */
@Builder
public record TaxmanSettings(TaxPeriod period,
                             AccountingPrinciple principle,
                             boolean multiDepot,
                             FiatRegistry fiatRegistry,
                             boolean allAirdropsAreGifts) {

    public TaxmanSettings {
        Objects.requireNonNull(period, "tax period must not be null");
        Objects.requireNonNull(principle, "accounting principle must not be null");
        Objects.requireNonNull(fiatRegistry, "fiat registry must not be null");
    }
}
