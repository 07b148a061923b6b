package com.cointax.costbasis.engine;

import com.cointax.domain.EvaluationWarning;
import com.cointax.domain.PortfolioSnapshot;
import com.cointax.domain.report.ReportEntryType;
import com.cointax.domain.report.TaxReportEntry;

import java.util.List;

/**
 * Outcome of a complete evaluation: report entries in emission order, holdings at the deadline
 * and the data-quality warnings raised on the way.
 */
public record EvaluationResult(TaxPeriod period,
                               List<TaxReportEntry> entries,
                               PortfolioSnapshot portfolio,
                               List<EvaluationWarning> warnings) {

    public EvaluationResult {
        entries = List.copyOf(entries);
        warnings = List.copyOf(warnings);
    }

    public List<TaxReportEntry> realizedEntries() {
        return entries.stream().filter(e -> e.getEventType() != ReportEntryType.UNREALIZED_SELL).toList();
    }

    public List<TaxReportEntry> unrealizedEntries() {
        return entries.stream().filter(e -> e.getEventType() == ReportEntryType.UNREALIZED_SELL).toList();
    }

    public List<TaxReportEntry> entriesOf(ReportEntryType type) {
        return entries.stream().filter(e -> e.getEventType() == type).toList();
    }
}
