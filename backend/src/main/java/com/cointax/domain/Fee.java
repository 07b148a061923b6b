package com.cointax.domain;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Fee paid for an operation. Carries the platform and timestamp of its operation so it can be
 * priced and removed from the matching balance on its own.
 */
@Getter
public final class Fee implements CoinAmount {

    private final String platform;
    private final String coin;
    private final BigDecimal change;
    private final Instant utcTime;

    private Fee(String platform, String coin, BigDecimal change, Instant utcTime) {
        this.platform = Objects.requireNonNull(platform, "fee platform must not be null");
        this.coin = Objects.requireNonNull(coin, "fee coin must not be null");
        this.change = Objects.requireNonNull(change, "fee change must not be null");
        this.utcTime = Objects.requireNonNull(utcTime, "fee utcTime must not be null");
        if (change.signum() < 0) {
            throw new IllegalArgumentException("Fee must not be negative, got: " + change);
        }
    }

    public static Fee of(String platform, String coin, BigDecimal change, Instant utcTime) {
        return new Fee(platform, coin, change, utcTime);
    }

    @Override
    public String toString() {
        return change.toPlainString() + " " + coin + " on " + platform;
    }
}
