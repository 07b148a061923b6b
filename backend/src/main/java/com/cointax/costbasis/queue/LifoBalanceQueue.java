package com.cointax.costbasis.queue;

import java.util.Deque;

/**
 * Last in, first out: the newest lot is consumed first.
 */
public class LifoBalanceQueue extends BalanceQueue {

    public LifoBalanceQueue(String coin) {
        super(coin);
    }

    @Override
    protected Lot next(Deque<Lot> lots) {
        return lots.peekLast();
    }

    @Override
    protected void dropNext(Deque<Lot> lots) {
        lots.pollLast();
    }
}
