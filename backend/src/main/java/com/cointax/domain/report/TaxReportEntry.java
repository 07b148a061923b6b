package com.cointax.domain.report;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

/**
 * Base of all tax-relevant records emitted by the engine. Immutable.
 * <p>
 * {@link #getTaxableGainInFiat()} is zero whenever the entry is not taxable.
 */
@Getter
@SuperBuilder
public abstract class TaxReportEntry {

    private final String coin;
    private final BigDecimal amount;
    /** Category label of the jurisdiction, e.g. "Sonstige Einkünfte"; null if not tax relevant. */
    private final String taxationType;
    private final boolean taxable;
    @Builder.Default
    private final String remark = "";

    public abstract ReportEntryType getEventType();

    /** Gain (or received value) in the reporting fiat, regardless of taxability. */
    public abstract BigDecimal getGainInFiat();

    public BigDecimal getTaxableGainInFiat() {
        return isTaxable() ? getGainInFiat() : BigDecimal.ZERO;
    }
}
