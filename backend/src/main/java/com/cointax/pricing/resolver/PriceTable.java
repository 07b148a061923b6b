package com.cointax.pricing.resolver;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory price quotes indexed by coin, each list sorted by time.
 */
public final class PriceTable {

    private static final PriceTable EMPTY = new PriceTable(List.of());

    private final Map<String, List<PriceQuote>> quotesByCoin = new HashMap<>();

    public PriceTable(Collection<PriceQuote> quotes) {
        for (PriceQuote q : quotes) {
            if (q.coin() == null || q.utcTime() == null || q.price() == null) {
                throw new IllegalArgumentException("Incomplete price quote: " + q);
            }
            quotesByCoin.computeIfAbsent(key(q.coin()), c -> new ArrayList<>()).add(q);
        }
        quotesByCoin.values().forEach(list -> list.sort(Comparator.comparing(PriceQuote::utcTime)));
    }

    public static PriceTable empty() {
        return EMPTY;
    }

    /**
     * Latest quote at or before {@code time} and not older than {@code maxAge}. A quote for the
     * given platform wins over a platform-independent one.
     */
    public Optional<PriceQuote> lookup(String platform, String coin, Instant time, Duration maxAge) {
        List<PriceQuote> quotes = quotesByCoin.get(key(coin));
        if (quotes == null) {
            return Optional.empty();
        }
        Instant oldest = time.minus(maxAge);
        PriceQuote platformMatch = null;
        PriceQuote anyPlatform = null;
        for (PriceQuote q : quotes) {
            if (q.utcTime().isAfter(time)) {
                break;
            }
            if (q.utcTime().isBefore(oldest)) {
                continue;
            }
            if (q.platform() == null || q.platform().isBlank()) {
                anyPlatform = q;
            } else if (q.platform().equalsIgnoreCase(platform)) {
                platformMatch = q;
            }
        }
        PriceQuote best = platformMatch != null ? platformMatch : anyPlatform;
        return Optional.ofNullable(best);
    }

    public int size() {
        return quotesByCoin.values().stream().mapToInt(List::size).sum();
    }

    private static String key(String coin) {
        return coin.strip().toUpperCase(Locale.ROOT);
    }
}
