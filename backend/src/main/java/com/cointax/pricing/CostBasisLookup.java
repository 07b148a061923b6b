package com.cointax.pricing;

import com.cointax.common.Decimals;
import com.cointax.domain.CoinAmount;
import com.cointax.domain.ConsumedLot;

import java.math.BigDecimal;

/**
 * Fiat value of coin amounts at their own point in time. The boundary to historical price data.
 */
public interface CostBasisLookup {

    /**
     * Fiat value of {@code proportion} (0 &lt; p &lt;= 1) of the amount.
     *
     * @throws PriceUnavailableException if no price is known
     */
    BigDecimal partialCost(CoinAmount amount, BigDecimal proportion);

    default BigDecimal cost(CoinAmount amount) {
        return partialCost(amount, BigDecimal.ONE);
    }

    /** Acquisition cost of the consumed part of a lot, valued when the lot was acquired. */
    default BigDecimal cost(ConsumedLot lot) {
        return partialCost(lot.op(), Decimals.proportion(lot.amount(), lot.op().getChange()));
    }
}
