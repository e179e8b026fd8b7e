package com.nft.market.nft_market.entity;

import java.math.BigInteger;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A single purchase attempt against a listing.
 *
 * Lifecycle: PENDING → FULFILLED | CANCELLED, each terminal state reached once.
 *
 * Price, fee and seller amount are fixed when the order is placed; later fee
 * changes never touch an order already in the book. Mutations go through
 * {@link com.nft.market.nft_market.store.OrderBook} so that they can be rolled
 * back with the request that made them.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "orders")
public class Order {

    @Id
    private Long orderId;

    @Indexed
    private Long listingId;

    private BigInteger itemId;

    private BigInteger price;

    private BigInteger platformFee;

    /**
     * price - platformFee, computed once when the order is placed.
     */
    private BigInteger sellerAmount;

    @Indexed
    private String buyer;

    @Indexed
    private String seller;

    private long createdAt;

    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    private long updatedAt;

    /**
     * Set when the order reaches a terminal state.
     */
    private Long completedAt;

    private String cancellationReason;

    // ===== State Machine Methods =====

    /**
     * Transition order to a new status with validation.
     *
     * @throws IllegalStateException if transition is invalid
     */
    public void transitionTo(OrderStatus newStatus, long timestamp) {
        if (!this.status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                String.format("Invalid order state transition: %s → %s (orderId=%s)",
                    this.status, newStatus, this.orderId));
        }

        this.status = newStatus;
        this.updatedAt = timestamp;

        if (newStatus.isTerminal()) {
            this.completedAt = timestamp;
        }
    }

    public void fulfill(long timestamp) {
        transitionTo(OrderStatus.FULFILLED, timestamp);
    }

    public void cancel(String reason, long timestamp) {
        transitionTo(OrderStatus.CANCELLED, timestamp);
        this.cancellationReason = reason;
    }

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    public Order copy() {
        return toBuilder().build();
    }
}
