package com.cointax.domain.report;

import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Interest received from lending or staking, valued at receipt.
 */
@Getter
@SuperBuilder
public class InterestReportEntry extends TaxReportEntry {

    private final ReportEntryType kind;
    private final String platform;
    private final Instant utcTime;
    private final BigDecimal interestInFiat;

    @Override
    public ReportEntryType getEventType() {
        return kind;
    }

    @Override
    public BigDecimal getGainInFiat() {
        return interestInFiat;
    }
}
