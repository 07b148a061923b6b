package com.cointax.common;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;
import java.util.function.Function;

/**
 * BigDecimal helpers shared by the engine. Amounts are never converted to floating point.
 */
public final class Decimals {

    /** Precision used for proportions (consumed / original amount). */
    public static final MathContext PROPORTION = MathContext.DECIMAL128;

    private Decimals() {
    }

    public static BigDecimal proportion(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            throw new ArithmeticException("Cannot build a proportion of a zero amount");
        }
        return part.divide(whole, PROPORTION);
    }

    public static <T> BigDecimal sum(Collection<T> items, Function<T, BigDecimal> amount) {
        BigDecimal total = BigDecimal.ZERO;
        for (T item : items) {
            total = total.add(amount.apply(item));
        }
        return total;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
