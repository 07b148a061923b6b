package com.cointax.domain;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Holdings at the evaluation deadline: platform → coin → amount. Built incrementally while the
 * lot queues are drained; missing entries read as zero.
 */
public class PortfolioSnapshot {

    private final NavigableMap<String, NavigableMap<String, BigDecimal>> holdings = new TreeMap<>();

    public void add(String platform, String coin, BigDecimal amount) {
        holdings.computeIfAbsent(platform, p -> new TreeMap<>())
                .merge(coin, amount, BigDecimal::add);
    }

    public BigDecimal amount(String platform, String coin) {
        Map<String, BigDecimal> coins = holdings.get(platform);
        if (coins == null) {
            return BigDecimal.ZERO;
        }
        return coins.getOrDefault(coin, BigDecimal.ZERO);
    }

    /** Total of a coin over all platforms. */
    public BigDecimal total(String coin) {
        BigDecimal total = BigDecimal.ZERO;
        for (Map<String, BigDecimal> coins : holdings.values()) {
            total = total.add(coins.getOrDefault(coin, BigDecimal.ZERO));
        }
        return total;
    }

    public boolean isEmpty() {
        return holdings.isEmpty();
    }

    public Map<String, Map<String, BigDecimal>> asMap() {
        Map<String, Map<String, BigDecimal>> view = new TreeMap<>();
        holdings.forEach((platform, coins) -> view.put(platform, Collections.unmodifiableMap(coins)));
        return Collections.unmodifiableMap(view);
    }
}
