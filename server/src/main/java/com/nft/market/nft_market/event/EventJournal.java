package com.nft.market.nft_market.event;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.springframework.context.event.EventListener;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only, bounded record of committed marketplace events.
 */
@Slf4j
public class EventJournal {

    static final int MAX_ENTRIES = 10_000;

    private final Deque<Entry> entries = new ArrayDeque<>();
    private final Clock clock;
    private long sequence;

    public EventJournal(Clock clock) {
        this.clock = clock;
    }

    @Value
    public static class Entry {
        long sequence;
        long timestamp;
        String type;
        MarketplaceEvent event;
    }

    @EventListener
    public synchronized void onEvent(MarketplaceEvent event) {
        entries.addLast(new Entry(++sequence, clock.millis(), event.getType(), event));
        while (entries.size() > MAX_ENTRIES) {
            entries.removeFirst();
        }
        log.debug("Recorded event #{}: {}", sequence, event);
    }

    /**
     * Most recent entries, oldest first.
     */
    public synchronized List<Entry> recent(int limit) {
        if (limit <= 0 || entries.isEmpty()) {
            return List.of();
        }
        List<Entry> all = new ArrayList<>(entries);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized int size() {
        return entries.size();
    }
}
