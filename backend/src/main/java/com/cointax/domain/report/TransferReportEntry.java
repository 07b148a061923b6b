package com.cointax.domain.report;

import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Informational record of an internal transfer. The implicit fee is the difference between the
 * withdrawn and the deposited amount. Never taxable.
 */
@Getter
@SuperBuilder
public class TransferReportEntry extends TaxReportEntry {

    /** Platform the coins arrived on. */
    private final String depositPlatform;
    /** Platform the coins left. */
    private final String withdrawalPlatform;
    private final Instant depositUtcTime;
    private final Instant withdrawalUtcTime;
    private final AllocatedFee fee;

    @Override
    public ReportEntryType getEventType() {
        return ReportEntryType.TRANSFER;
    }

    @Override
    public boolean isTaxable() {
        return false;
    }

    @Override
    public BigDecimal getGainInFiat() {
        return BigDecimal.ZERO;
    }
}
