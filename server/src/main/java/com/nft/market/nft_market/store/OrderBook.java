package com.nft.market.nft_market.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import com.nft.market.nft_market.entity.Order;
import com.nft.market.nft_market.execution.UnitOfWork;

/**
 * Orders keyed by order id.
 *
 * Orders are mutable, so the book only hands out copies and applies every
 * change through {@link #update}, which records the previous state for
 * rollback.
 */
public class OrderBook {

    private final Map<Long, Order> orders = new ConcurrentHashMap<>();
    private final Set<Long> touched = new LinkedHashSet<>();

    public void add(Order order) {
        long orderId = order.getOrderId();
        Order previous = orders.putIfAbsent(orderId, order.copy());
        if (previous != null) {
            throw new IllegalStateException("Order id already in use: " + orderId);
        }
        touch(orderId);
        UnitOfWork.onRollback(() -> orders.remove(orderId));
    }

    public Optional<Order> find(long orderId) {
        Order order = orders.get(orderId);
        return order != null ? Optional.of(order.copy()) : Optional.empty();
    }

    /**
     * Apply a change to a stored order.
     *
     * @return a copy of the order after the change
     * @throws IllegalArgumentException if the order does not exist
     */
    public Order update(long orderId, Consumer<Order> change) {
        Order order = orders.get(orderId);
        if (order == null) {
            throw new IllegalArgumentException("Order not found: " + orderId);
        }
        Order before = order.copy();
        change.accept(order);
        touch(orderId);
        UnitOfWork.onRollback(() -> orders.put(orderId, before));
        return order.copy();
    }

    public List<Order> findAll(Predicate<Order> filter) {
        return orders.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(Order::getOrderId))
                .map(Order::copy)
                .collect(Collectors.toList());
    }

    public int size() {
        return orders.size();
    }

    /**
     * Replace the contents with persisted orders (startup only).
     */
    public synchronized void load(Collection<Order> persisted) {
        orders.clear();
        touched.clear();
        persisted.forEach(o -> orders.put(o.getOrderId(), o.copy()));
    }

    public synchronized PendingWrites<Order> drainPendingWrites() {
        List<Order> saves = new ArrayList<>();
        List<Long> deletes = new ArrayList<>();
        for (Long orderId : touched) {
            Order order = orders.get(orderId);
            if (order != null) {
                saves.add(order.copy());
            } else {
                deletes.add(orderId);
            }
        }
        touched.clear();
        return new PendingWrites<>(saves, deletes);
    }

    /**
     * Mark writes that could not be persisted so the next drain returns them again.
     */
    public synchronized void markPending(PendingWrites<Order> writes) {
        writes.getSaves().forEach(e -> touched.add(e.getOrderId()));
        touched.addAll(writes.getDeletes());
    }

    private synchronized void touch(long orderId) {
        touched.add(orderId);
    }
}
