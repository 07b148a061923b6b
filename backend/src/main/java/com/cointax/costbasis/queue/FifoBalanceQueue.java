package com.cointax.costbasis.queue;

import java.util.Deque;

/**
 * First in, first out: the oldest lot is consumed first.
 */
public class FifoBalanceQueue extends BalanceQueue {

    public FifoBalanceQueue(String coin) {
        super(coin);
    }

    @Override
    protected Lot next(Deque<Lot> lots) {
        return lots.peekFirst();
    }

    @Override
    protected void dropNext(Deque<Lot> lots) {
        lots.pollFirst();
    }
}
