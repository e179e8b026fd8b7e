package com.nft.market.nft_market.event;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class EventJournalTest {

    private final EventJournal journal = new EventJournal(
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    void recentReturnsNewestEntriesInOrder() {
        for (int i = 1; i <= 5; i++) {
            journal.onEvent(new ItemNoLongerExists(i, BigInteger.valueOf(i)));
        }

        assertThat(journal.recent(2)).extracting(EventJournal.Entry::getSequence).containsExactly(4L, 5L);
        assertThat(journal.recent(0)).isEmpty();
        assertThat(journal.recent(100)).hasSize(5);
        assertThat(journal.recent(1).get(0).getType()).isEqualTo("ItemNoLongerExists");
    }

    @Test
    void oldestEntriesAreDroppedPastCapacity() {
        for (int i = 0; i < EventJournal.MAX_ENTRIES + 10; i++) {
            journal.onEvent(new ItemNoLongerExists(i, BigInteger.ONE));
        }

        assertThat(journal.size()).isEqualTo(EventJournal.MAX_ENTRIES);
        assertThat(journal.recent(EventJournal.MAX_ENTRIES).get(0).getSequence()).isEqualTo(11L);
    }
}
