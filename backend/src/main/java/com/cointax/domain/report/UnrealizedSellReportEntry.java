package com.cointax.domain.report;

import lombok.experimental.SuperBuilder;

/**
 * Hypothetical disposal of remaining holdings at the evaluation deadline.
 * Reported separately and never part of realized totals.
 */
@SuperBuilder
public class UnrealizedSellReportEntry extends SellReportEntry {

    @Override
    public ReportEntryType getEventType() {
        return ReportEntryType.UNREALIZED_SELL;
    }
}
