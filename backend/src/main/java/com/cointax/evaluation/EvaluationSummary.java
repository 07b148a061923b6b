package com.cointax.evaluation;

import com.cointax.costbasis.engine.EvaluationResult;
import com.cointax.domain.PortfolioSnapshot;
import com.cointax.domain.report.TaxReportEntry;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Totals of an evaluation: realized taxable gain per taxation type, unrealized gain at the
 * deadline and the closing portfolio.
 */
public final class EvaluationSummary {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final EvaluationResult result;
    private final String fiat;
    private final Map<String, BigDecimal> taxableGainByType;
    private final BigDecimal unrealizedGain;
    private final BigDecimal unrealizedTaxableGain;

    private EvaluationSummary(EvaluationResult result, String fiat) {
        this.result = result;
        this.fiat = fiat;
        Map<String, BigDecimal> byType = new LinkedHashMap<>();
        for (TaxReportEntry entry : result.realizedEntries()) {
            if (entry.getTaxationType() == null) {
                continue;
            }
            byType.merge(entry.getTaxationType(), entry.getTaxableGainInFiat(), BigDecimal::add);
        }
        this.taxableGainByType = Collections.unmodifiableMap(byType);
        BigDecimal gain = BigDecimal.ZERO;
        BigDecimal taxable = BigDecimal.ZERO;
        for (TaxReportEntry entry : result.unrealizedEntries()) {
            gain = gain.add(entry.getGainInFiat());
            taxable = taxable.add(entry.getTaxableGainInFiat());
        }
        this.unrealizedGain = gain;
        this.unrealizedTaxableGain = taxable;
    }

    public static EvaluationSummary of(EvaluationResult result, String fiat) {
        return new EvaluationSummary(result, fiat);
    }

    /** Realized taxable gain per taxation type, in order of first appearance. Unrealized entries are excluded. */
    public Map<String, BigDecimal> getTaxableGainByType() {
        return taxableGainByType;
    }

    public BigDecimal getUnrealizedGain() {
        return unrealizedGain;
    }

    public BigDecimal getUnrealizedTaxableGain() {
        return unrealizedTaxableGain;
    }

    public PortfolioSnapshot getPortfolio() {
        return result.portfolio();
    }

    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Your tax evaluation for ").append(result.period().year())
                .append(" (Deadline ").append(DATE.format(result.period().deadline().atZone(result.period().zone())))
                .append("):\n\n");
        taxableGainByType.forEach((type, gain) ->
                sb.append(type).append(": ").append(money(gain)).append(' ').append(fiat).append('\n'));
        sb.append("----------------------------------------\n")
                .append("Unrealized gain: ").append(money(unrealizedGain)).append(' ').append(fiat).append('\n')
                .append("Unrealized taxable gain at deadline: ").append(money(unrealizedTaxableGain)).append(' ')
                .append(fiat).append('\n')
                .append("----------------------------------------\n")
                .append("Your portfolio at the deadline was:\n");
        result.portfolio().asMap().forEach((platform, coins) -> coins.forEach((coin, amount) ->
                sb.append(platform).append(' ').append(coin).append(": ").append(money(amount)).append('\n')));
        if (!result.warnings().isEmpty()) {
            sb.append("----------------------------------------\n")
                    .append(result.warnings().size()).append(" warning(s) were raised, see the log.\n");
        }
        return sb.toString();
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
