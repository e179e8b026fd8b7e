package com.nft.market.nft_market.store;

import com.nft.market.nft_market.execution.UnitOfWork;

/**
 * Issues listing and order ids. Ids start at 1 and only grow; an id handed out
 * by a request that is rolled back is handed out again.
 */
public class SequenceAllocator {

    private final Counter listings = new Counter();
    private final Counter orders = new Counter();

    public long nextListingId() {
        return listings.increment();
    }

    public long nextOrderId() {
        return orders.increment();
    }

    public long currentListingId() {
        return listings.current;
    }

    public long currentOrderId() {
        return orders.current;
    }

    /**
     * Resume after the highest ids already persisted.
     */
    public void restore(long lastListingId, long lastOrderId) {
        listings.current = Math.max(listings.current, lastListingId);
        orders.current = Math.max(orders.current, lastOrderId);
    }

    private static final class Counter {
        private volatile long current;

        long increment() {
            long previous = current;
            current = previous + 1;
            UnitOfWork.onRollback(() -> current = previous);
            return current;
        }
    }
}
