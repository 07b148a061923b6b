package com.cointax.evaluation;

import com.cointax.common.FiatRegistry;
import com.cointax.config.TaxProperties;
import com.cointax.costbasis.engine.EvaluationResult;
import com.cointax.costbasis.engine.TaxPeriod;
import com.cointax.costbasis.engine.Taxman;
import com.cointax.costbasis.engine.TaxmanSettings;
import com.cointax.costbasis.rule.TaxationRule;
import com.cointax.costbasis.rule.TaxationRuleRegistry;
import com.cointax.domain.Operation;
import com.cointax.pricing.CostBasisLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Entry point for evaluating a ledger: builds a {@link Taxman} from configuration, runs it and
 * logs the summary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaxEvaluationService {

    private final TaxProperties taxProperties;
    private final TaxationRuleRegistry taxationRuleRegistry;
    private final CostBasisLookup costBasisLookup;
    private final FiatRegistry fiatRegistry;
    private final Clock clock;

    /**
     * Builds the engine for the configured country and principle. Fails before any operation is
     * touched if the country is not supported.
     */
    public Taxman newTaxman() {
        TaxationRule rule = taxationRuleRegistry.forCountry(taxProperties.getCountry());
        TaxmanSettings settings = TaxmanSettings.builder()
                .period(TaxPeriod.of(taxProperties.getTaxYear(), taxProperties.getLocalTimezone(), clock))
                .principle(taxProperties.getPrinciple())
                .multiDepot(taxProperties.isMultiDepot())
                .fiatRegistry(fiatRegistry)
                .allAirdropsAreGifts(taxProperties.isAllAirdropsAreGifts())
                .build();
        return new Taxman(settings, rule, costBasisLookup);
    }

    public EvaluationResult evaluate(List<Operation> operations) {
        Taxman taxman = newTaxman();
        log.info("Evaluating {} operations for {} ({}, {})", operations.size(), taxProperties.getTaxYear(),
                taxProperties.getCountry(), taxProperties.getPrinciple());
        EvaluationResult result = taxman.evaluate(operations);
        log.info("Evaluation complete: {} report entries, {} warnings", result.entries().size(), result.warnings().size());
        log.info(EvaluationSummary.of(result, taxProperties.getFiat()).toText());
        return result;
    }
}
