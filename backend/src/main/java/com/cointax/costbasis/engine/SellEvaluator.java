package com.cointax.costbasis.engine;

import com.cointax.common.Decimals;
import com.cointax.costbasis.EvaluationWarnings;
import com.cointax.costbasis.fee.FeeAllocator;
import com.cointax.costbasis.rule.TaxationRule;
import com.cointax.domain.ConsumedLot;
import com.cointax.domain.Operation;
import com.cointax.domain.WarningCode;
import com.cointax.domain.report.FeeBreakdown;
import com.cointax.domain.report.SellReportEntry;
import com.cointax.domain.report.UnrealizedSellReportEntry;
import com.cointax.pricing.CostBasisLookup;
import com.cointax.pricing.PriceUnavailableException;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

/**
 * Evaluates the disposal of one consumed lot. Shared by realized sells and the deadline
 * liquidation.
 */
@RequiredArgsConstructor
public class SellEvaluator {

    private final CostBasisLookup costBasisLookup;
    private final FeeAllocator feeAllocator;
    private final TaxationRule taxationRule;
    private final EvaluationWarnings warnings;

    /**
     * Realized sell of {@code lot} as part of {@code sell}. A missing sell price aborts the run.
     *
     * @param additionalFee        fiat amount added to the acquisition cost
     * @param excludedTransferFee  transfer fee (in coin) attributable to the lot, reported only
     */
    public SellReportEntry evaluate(Operation sell, ConsumedLot lot, BigDecimal additionalFee,
                                    BigDecimal excludedTransferFee) {
        return build(SellReportEntry.builder(), sell, lot, additionalFee, excludedTransferFee, false);
    }

    /**
     * Hypothetical sell of {@code lot} at the deadline. A missing price yields a zero sell value
     * and a warning.
     */
    public SellReportEntry evaluateUnrealized(Operation unrealizedSell, ConsumedLot lot) {
        return build(UnrealizedSellReportEntry.builder(), unrealizedSell, lot, BigDecimal.ZERO, BigDecimal.ZERO, true);
    }

    private SellReportEntry build(SellReportEntry.SellReportEntryBuilder<?, ?> builder, Operation sell,
                                  ConsumedLot lot, BigDecimal additionalFee, BigDecimal excludedTransferFee,
                                  boolean unrealized) {
        Operation acquisition = lot.op();
        if (!sell.getCoin().equals(acquisition.getCoin())) {
            throw new IllegalStateException("Sold " + sell.getCoin() + " matched against a " + acquisition.getCoin() + " lot");
        }
        BigDecimal proportion = Decimals.proportion(lot.amount(), sell.getChange());

        FeeBreakdown fees = feeAllocator.allocate(sell, proportion);
        BigDecimal buyValue = costBasisLookup.cost(lot)
                .add(feeAllocator.acquisitionFees(lot))
                .add(additionalFee);
        BigDecimal sellValue = sellValue(sell, proportion, unrealized);

        return builder
                .coin(sell.getCoin())
                .amount(lot.amount())
                .sellPlatform(sell.getPlatform())
                .buyPlatform(acquisition.getPlatform())
                .sellUtcTime(sell.getUtcTime())
                .buyUtcTime(acquisition.getUtcTime())
                .fees(fees)
                .sellValueInFiat(sellValue)
                .buyValueInFiat(buyValue)
                .excludedTransferFee(excludedTransferFee)
                .taxable(taxationRule.isTaxable(acquisition.getUtcTime(), sell.getUtcTime()))
                .taxationType(taxationRule.sellTaxationType())
                .remark(sell.getRemark())
                .build();
    }

    private BigDecimal sellValue(Operation sell, BigDecimal proportion, boolean unrealized) {
        try {
            return costBasisLookup.partialCost(sell, proportion);
        } catch (PriceUnavailableException e) {
            if (!unrealized) {
                throw e;
            }
            warnings.add(WarningCode.UNREALIZED_PRICE_UNKNOWN, "Unable to value your " + sell.getCoin() + " on "
                    + sell.getPlatform() + " at the evaluation deadline " + sell.getUtcTime()
                    + "; the unrealized sell value is set to zero. Add a price for this date to the price table.", null);
            return BigDecimal.ZERO;
        }
    }
}
