package com.cointax.costbasis.queue;

import com.cointax.costbasis.exception.InsufficientBalanceException;
import com.cointax.costbasis.exception.NegativeBalanceException;
import com.cointax.domain.ConsumedLot;
import com.cointax.domain.Fee;
import com.cointax.domain.Operation;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Ordered acquisition lots of one balance key (coin, or platform and coin).
 * Subclasses only decide which end of the queue a disposal consumes first.
 * <p>
 * Removal is all-or-nothing: the available total is checked before any lot is touched, so a
 * failed removal leaves the queue unchanged.
 */
public abstract class BalanceQueue {

    private final String coin;
    private final Deque<Lot> lots = new ArrayDeque<>();

    protected BalanceQueue(String coin) {
        this.coin = coin;
    }

    /** The lot a disposal consumes next. */
    protected abstract Lot next(Deque<Lot> lots);

    /** Drops the lot returned by {@link #next(Deque)} once it is used up. */
    protected abstract void dropNext(Deque<Lot> lots);

    public String getCoin() {
        return coin;
    }

    public void add(Operation op) {
        if (!coin.equals(op.getCoin())) {
            throw new IllegalArgumentException("Cannot add " + op.getCoin() + " to the " + coin + " balance");
        }
        lots.addLast(new Lot(op));
    }

    /**
     * Removes the amount of a disposal (sell or withdrawal) in accounting order.
     *
     * @return consumed lots in the order they were consumed; amounts sum to {@code op.getChange()}
     * @throws InsufficientBalanceException if less than the amount is held
     */
    public List<ConsumedLot> remove(Operation op) {
        return remove(op.getChange(), op.toString() + " (" + op.describeSource() + ")");
    }

    public List<ConsumedLot> remove(BigDecimal amount) {
        return remove(amount, null);
    }

    /**
     * Removes a paid fee. Zero fees consume nothing.
     */
    public List<ConsumedLot> removeFee(Fee fee) {
        if (fee.getChange().signum() == 0) {
            return List.of();
        }
        return remove(fee.getChange(), "fee " + fee);
    }

    /** Drains every lot. Used for the deadline liquidation only. */
    public List<ConsumedLot> removeAll() {
        List<ConsumedLot> consumed = new ArrayList<>(lots.size());
        while (!lots.isEmpty()) {
            Lot lot = next(lots);
            if (lot.getRemaining().signum() > 0) {
                consumed.add(new ConsumedLot(lot.getOp(), lot.getRemaining()));
            }
            lot.take(lot.getRemaining());
            dropNext(lots);
        }
        return consumed;
    }

    /**
     * @throws NegativeBalanceException if any lot has a negative remaining amount
     */
    public void sanityCheck() {
        for (Lot lot : lots) {
            if (lot.getRemaining().signum() < 0) {
                throw new NegativeBalanceException("Negative balance of " + lot.getRemaining().toPlainString()
                        + " " + coin + " in lot from " + lot.getOp());
            }
        }
    }

    public BigDecimal total() {
        BigDecimal total = BigDecimal.ZERO;
        for (Lot lot : lots) {
            total = total.add(lot.getRemaining());
        }
        return total;
    }

    public boolean isEmpty() {
        return lots.isEmpty();
    }

    public int size() {
        return lots.size();
    }

    /** Lots in acquisition order (oldest first), regardless of the accounting principle. */
    public List<Lot> lots() {
        return List.copyOf(lots);
    }

    private List<ConsumedLot> remove(BigDecimal amount, String context) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount to remove must be positive, got: " + amount);
        }
        BigDecimal available = total();
        if (available.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(coin, amount, available, context);
        }

        List<ConsumedLot> consumed = new ArrayList<>();
        BigDecimal open = amount;
        while (open.signum() > 0) {
            Lot lot = next(lots);
            BigDecimal take = open.min(lot.getRemaining());
            if (take.signum() > 0) {
                lot.take(take);
                consumed.add(new ConsumedLot(lot.getOp(), take));
                open = open.subtract(take);
            }
            if (lot.getRemaining().signum() == 0) {
                dropNext(lots);
            }
        }
        return consumed;
    }
}
