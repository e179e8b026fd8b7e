package com.nft.market.nft_market.entity;

/**
 * Order state machine.
 *
 * State Transitions:
 *
 * PENDING → FULFILLED  (ledger confirmed the fee leg and the item reached the buyer)
 * PENDING → CANCELLED  (a settlement step failed or the listing went stale)
 *
 * Terminal states: FULFILLED, CANCELLED
 * (Once reached, no further transitions allowed)
 */
public enum OrderStatus {

    /**
     * PENDING: Order recorded by buy, waiting for the ledger callback.
     * Next: FULFILLED or CANCELLED
     */
    PENDING,

    /**
     * FULFILLED: Price and fee moved, item transferred to the buyer.
     * TERMINAL STATE - no further transitions.
     */
    FULFILLED,

    /**
     * CANCELLED: Settlement abandoned.
     * TERMINAL STATE - no further transitions.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == FULFILLED || this == CANCELLED;
    }

    public boolean canTransitionTo(OrderStatus to) {
        if (this.isTerminal()) {
            return false;
        }
        return to == FULFILLED || to == CANCELLED;
    }
}
