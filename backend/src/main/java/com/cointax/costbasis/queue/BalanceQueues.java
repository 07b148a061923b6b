package com.cointax.costbasis.queue;

import com.cointax.domain.AccountingPrinciple;
import com.cointax.domain.CoinAmount;
import com.cointax.domain.ConsumedLot;
import com.cointax.domain.Fee;
import com.cointax.domain.Operation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * All balance queues of one evaluation, created on first use.
 * With {@code multiDepot} every platform keeps its own queue per coin; otherwise coins are pooled
 * across platforms.
 */
public class BalanceQueues {

    private final AccountingPrinciple principle;
    private final boolean multiDepot;
    private final Map<BalanceKey, BalanceQueue> queues = new LinkedHashMap<>();

    public BalanceQueues(AccountingPrinciple principle, boolean multiDepot) {
        this.principle = Objects.requireNonNull(principle, "accounting principle must not be null");
        this.multiDepot = multiDepot;
    }

    public BalanceQueue balance(String platform, String coin) {
        BalanceKey key = new BalanceKey(multiDepot ? platform : null, coin);
        return queues.computeIfAbsent(key, k -> newQueue(coin));
    }

    public BalanceQueue balance(CoinAmount amount) {
        return balance(amount.getPlatform(), amount.getCoin());
    }

    public void add(Operation op) {
        balance(op).add(op);
    }

    public List<ConsumedLot> remove(Operation op) {
        return balance(op).remove(op);
    }

    public void removeFees(List<Fee> fees) {
        for (Fee fee : fees) {
            balance(fee).removeFee(fee);
        }
    }

    public Collection<BalanceQueue> all() {
        return Collections.unmodifiableCollection(queues.values());
    }

    public AccountingPrinciple getPrinciple() {
        return principle;
    }

    public boolean isMultiDepot() {
        return multiDepot;
    }

    private BalanceQueue newQueue(String coin) {
        return switch (principle) {
            case FIFO -> new FifoBalanceQueue(coin);
            case LIFO -> new LifoBalanceQueue(coin);
        };
    }

    /** Platform is null when coins are pooled across platforms. */
    record BalanceKey(String platform, String coin) {
    }
}
