package com.cointax.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An amount of a coin on a platform at a point in time. The unit priced by the cost-basis lookup.
 */
public interface CoinAmount {

    String getPlatform();

    String getCoin();

    BigDecimal getChange();

    Instant getUtcTime();
}
