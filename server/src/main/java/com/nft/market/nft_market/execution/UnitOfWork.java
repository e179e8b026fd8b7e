package com.nft.market.nft_market.execution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.nft.market.nft_market.event.MarketplaceEvent;

/**
 * Journal of one serialized marketplace request.
 *
 * Every store mutation registers a compensation here and every event is
 * buffered here. Commit hands the buffered events back for publication;
 * rollback runs the compensations newest first and drops the events, leaving
 * no trace of the request.
 *
 * Bound to the executing thread for the duration of the request, so nested
 * calls (including the ledger callback) join the same unit.
 */
public final class UnitOfWork {

    private static final ThreadLocal<UnitOfWork> CURRENT = new ThreadLocal<>();

    private final String name;
    private final Deque<Runnable> compensations = new ArrayDeque<>();
    private final List<MarketplaceEvent> events = new ArrayList<>();
    private boolean completed;

    private UnitOfWork(String name) {
        this.name = name;
    }

    public static UnitOfWork begin(String name) {
        if (CURRENT.get() != null) {
            throw new IllegalStateException(
                "Unit of work '" + CURRENT.get().name + "' already active, cannot begin '" + name + "'");
        }
        UnitOfWork unit = new UnitOfWork(name);
        CURRENT.set(unit);
        return unit;
    }

    public static Optional<UnitOfWork> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Register an undo action with the active unit. Outside a unit (startup
     * loading, tests seeding fixtures) mutations are final and nothing is
     * recorded.
     */
    public static void onRollback(Runnable compensation) {
        UnitOfWork unit = CURRENT.get();
        if (unit != null) {
            unit.ensureOpen();
            unit.compensations.push(compensation);
        }
    }

    /**
     * Buffer an event until the active unit commits.
     *
     * @throws IllegalStateException if no unit is active
     */
    public static void emit(MarketplaceEvent event) {
        UnitOfWork unit = CURRENT.get();
        if (unit == null) {
            throw new IllegalStateException("No active unit of work to emit " + event.getType());
        }
        unit.ensureOpen();
        unit.events.add(event);
    }

    public String getName() {
        return name;
    }

    public List<MarketplaceEvent> commit() {
        ensureOpen();
        completed = true;
        CURRENT.remove();
        compensations.clear();
        return List.copyOf(events);
    }

    public void rollback() {
        ensureOpen();
        completed = true;
        try {
            while (!compensations.isEmpty()) {
                compensations.pop().run();
            }
        } finally {
            events.clear();
            CURRENT.remove();
        }
    }

    private void ensureOpen() {
        if (completed) {
            throw new IllegalStateException("Unit of work '" + name + "' already completed");
        }
    }
}
