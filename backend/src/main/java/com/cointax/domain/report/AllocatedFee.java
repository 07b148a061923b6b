package com.cointax.domain.report;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A fee share attributed to one report entry: amount in the fee coin and its fiat value.
 */
public record AllocatedFee(BigDecimal amount, String coin, BigDecimal inFiat) {

    private static final AllocatedFee NONE = new AllocatedFee(BigDecimal.ZERO, "", BigDecimal.ZERO);

    public AllocatedFee {
        Objects.requireNonNull(amount, "fee amount must not be null");
        Objects.requireNonNull(coin, "fee coin must not be null");
        Objects.requireNonNull(inFiat, "fee inFiat must not be null");
    }

    public static AllocatedFee none() {
        return NONE;
    }

    public boolean isNone() {
        return coin.isEmpty();
    }
}
