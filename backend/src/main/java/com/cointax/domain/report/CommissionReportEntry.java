package com.cointax.domain.report;

import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@SuperBuilder
public class CommissionReportEntry extends TaxReportEntry {

    private final String platform;
    private final Instant utcTime;
    private final BigDecimal inFiat;

    @Override
    public ReportEntryType getEventType() {
        return ReportEntryType.COMMISSION;
    }

    @Override
    public BigDecimal getGainInFiat() {
        return inFiat;
    }
}
