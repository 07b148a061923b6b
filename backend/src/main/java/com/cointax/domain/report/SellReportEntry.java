package com.cointax.domain.report;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Realized disposal of (part of) one acquisition lot.
 * Gain = sell value − buy value − disposal fees.
 */
@Getter
@SuperBuilder
public class SellReportEntry extends TaxReportEntry {

    private final String sellPlatform;
    private final String buyPlatform;
    private final Instant sellUtcTime;
    private final Instant buyUtcTime;
    @Builder.Default
    private final FeeBreakdown fees = FeeBreakdown.empty();
    private final BigDecimal sellValueInFiat;
    /** Acquisition cost including prorated acquisition fees. */
    private final BigDecimal buyValueInFiat;
    /** Transfer fee (in coin) attributable to this entry; reported but not deducted. */
    @Builder.Default
    private final BigDecimal excludedTransferFee = BigDecimal.ZERO;

    @Override
    public ReportEntryType getEventType() {
        return ReportEntryType.SELL;
    }

    @Override
    public BigDecimal getGainInFiat() {
        return sellValueInFiat.subtract(buyValueInFiat).subtract(fees.totalInFiat());
    }
}
