package com.cointax.costbasis.fee;

import com.cointax.common.Decimals;
import com.cointax.costbasis.exception.UnsupportedFeeStructureException;
import com.cointax.domain.ConsumedLot;
import com.cointax.domain.Fee;
import com.cointax.domain.Operation;
import com.cointax.domain.report.AllocatedFee;
import com.cointax.domain.report.FeeBreakdown;
import com.cointax.pricing.CostBasisLookup;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Prorates fees across the partial matches of a disposal.
 * A disposal consumed from several lots gets one share of its fees per lot.
 */
@RequiredArgsConstructor
public class FeeAllocator {

    public static final int MAX_FEE_COINS = 2;

    private final CostBasisLookup costBasisLookup;

    /**
     * Share {@code proportion} of the disposal's fees.
     *
     * @throws UnsupportedFeeStructureException if more than two fees are declared
     */
    public FeeBreakdown allocate(Operation disposal, BigDecimal proportion) {
        List<Fee> fees = disposal.getFees();
        if (fees.size() > MAX_FEE_COINS) {
            throw new UnsupportedFeeStructureException("More than " + MAX_FEE_COINS
                    + " fee coins are not supported: " + disposal + " (" + disposal.describeSource() + ")");
        }
        AllocatedFee first = fees.size() >= 1 ? allocate(fees.get(0), proportion) : AllocatedFee.none();
        AllocatedFee second = fees.size() >= 2 ? allocate(fees.get(1), proportion) : AllocatedFee.none();
        return new FeeBreakdown(first, second);
    }

    public AllocatedFee allocate(Fee fee, BigDecimal proportion) {
        return new AllocatedFee(fee.getChange().multiply(proportion), fee.getCoin(), inFiat(fee, proportion));
    }

    /**
     * Fiat value of the fees paid when the consumed lot was acquired, prorated by the consumed
     * share of the lot. These fees add to the cost basis.
     */
    public BigDecimal acquisitionFees(ConsumedLot lot) {
        Operation acquisition = lot.op();
        if (!acquisition.hasFees()) {
            return BigDecimal.ZERO;
        }
        BigDecimal share = Decimals.proportion(lot.amount(), acquisition.getChange());
        BigDecimal total = BigDecimal.ZERO;
        for (Fee fee : acquisition.getFees()) {
            total = total.add(inFiat(fee, share));
        }
        return total;
    }

    private BigDecimal inFiat(Fee fee, BigDecimal proportion) {
        if (fee.getChange().signum() == 0) {
            return BigDecimal.ZERO;
        }
        return costBasisLookup.partialCost(fee, proportion);
    }
}
