package com.cointax.costbasis.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TaxPeriodTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    @Test
    @DisplayName("a past year ends on 31 December 23:59:59 local time")
    void pastYear() {
        TaxPeriod period = TaxPeriod.of(2023, BERLIN, Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC));

        assertThat(period.deadline()).isEqualTo(Instant.parse("2023-12-31T22:59:59Z"));
    }

    @Test
    @DisplayName("the running year ends now")
    void runningYear() {
        Instant now = Instant.parse("2024-05-01T00:00:00Z");

        assertThat(TaxPeriod.of(2024, BERLIN, Clock.fixed(now, ZoneOffset.UTC)).deadline()).isEqualTo(now);
    }

    @Test
    @DisplayName("year membership is decided in the local zone")
    void localYear() {
        TaxPeriod period = TaxPeriod.of(2024, BERLIN, Clock.fixed(Instant.parse("2025-05-01T00:00:00Z"), ZoneOffset.UTC));

        // 00:30 on 1 January in Berlin
        Instant newYearBerlin = Instant.parse("2024-12-31T23:30:00Z");
        assertThat(period.contains(newYearBerlin)).isFalse();
        assertThat(period.isAfterPeriod(newYearBerlin)).isTrue();
        assertThat(period.contains(Instant.parse("2023-12-31T23:30:00Z"))).isTrue();
        assertThat(period.isAfterPeriod(Instant.parse("2023-06-01T00:00:00Z"))).isFalse();
    }
}
