package com.cointax.pricing;

import com.cointax.domain.CoinAmount;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Request for the fiat price of one unit of a coin on a platform at a point in time.
 */
@NoArgsConstructor
@Getter
@Setter
public class HistoricalPriceRequest {

    private String platform;
    private String coin;
    private Instant utcTime;

    public static HistoricalPriceRequest of(CoinAmount amount) {
        HistoricalPriceRequest request = new HistoricalPriceRequest();
        request.setPlatform(amount.getPlatform());
        request.setCoin(amount.getCoin());
        request.setUtcTime(amount.getUtcTime());
        return request;
    }

    @Override
    public String toString() {
        return coin + " on " + platform + " at " + utcTime;
    }
}
