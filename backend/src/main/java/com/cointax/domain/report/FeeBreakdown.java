package com.cointax.domain.report;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Fees of a disposal, split by at most two fee coins.
 */
public record FeeBreakdown(AllocatedFee first, AllocatedFee second) {

    private static final FeeBreakdown EMPTY = new FeeBreakdown(AllocatedFee.none(), AllocatedFee.none());

    public FeeBreakdown {
        Objects.requireNonNull(first, "first fee must not be null");
        Objects.requireNonNull(second, "second fee must not be null");
    }

    public static FeeBreakdown empty() {
        return EMPTY;
    }

    public BigDecimal totalInFiat() {
        return first.inFiat().add(second.inFiat());
    }
}
