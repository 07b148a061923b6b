package com.cointax.costbasis.engine;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * The evaluated calendar year in the taxpayer's zone. The deadline is the end of the year, or
 * now if the year is not over yet; remaining holdings are valued at the deadline.
 */
public record TaxPeriod(int year, ZoneId zone, Instant deadline) {

    public TaxPeriod {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(deadline, "deadline must not be null");
    }

    public static TaxPeriod of(int year, ZoneId zone, Clock clock) {
        Instant yearEnd = endOfYear(year, zone);
        Instant now = clock.instant();
        return new TaxPeriod(year, zone, now.isBefore(yearEnd) ? now : yearEnd);
    }

    /** Last second of the year in the given zone. */
    public static Instant endOfYear(int year, ZoneId zone) {
        return LocalDateTime.of(year, 12, 31, 23, 59, 59).atZone(zone).toInstant();
    }

    public boolean contains(Instant time) {
        return time.atZone(zone).getYear() == year;
    }

    /** True for times in a later year than the evaluated one. */
    public boolean isAfterPeriod(Instant time) {
        return time.atZone(zone).getYear() > year;
    }
}
