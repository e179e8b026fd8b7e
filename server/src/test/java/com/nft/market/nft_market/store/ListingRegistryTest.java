package com.nft.market.nft_market.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.nft.market.nft_market.entity.Listing;
import com.nft.market.nft_market.execution.UnitOfWork;

class ListingRegistryTest {

    private final ListingRegistry registry = new ListingRegistry();

    @Test
    void duplicateIdIsRejected() {
        registry.add(listing(1));

        assertThatThrownBy(() -> registry.add(listing(1))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void findAllIsOrderedById() {
        registry.add(listing(3));
        registry.add(listing(1));
        registry.add(listing(2));

        assertThat(registry.findAll()).extracting(Listing::getListingId).containsExactly(1L, 2L, 3L);
    }

    @Test
    void rollbackUndoesAddAndRemove() {
        registry.add(listing(1));
        UnitOfWork unit = UnitOfWork.begin("test");
        registry.add(listing(2));
        assertThat(registry.remove(1)).isTrue();

        unit.rollback();

        assertThat(registry.find(1)).isPresent();
        assertThat(registry.find(2)).isEmpty();
    }

    @Test
    void drainReportsSavesAndDeletes() {
        registry.add(listing(1));
        registry.add(listing(2));
        registry.remove(2);

        PendingWrites<Listing> writes = registry.drainPendingWrites();

        assertThat(writes.getSaves()).extracting(Listing::getListingId).containsExactly(1L);
        assertThat(writes.getDeletes()).containsExactly(2L);
        assertThat(registry.drainPendingWrites().isEmpty()).isTrue();
    }

    @Test
    void markPendingRequeuesFailedWrites() {
        registry.add(listing(1));
        PendingWrites<Listing> writes = registry.drainPendingWrites();

        registry.markPending(writes);

        assertThat(registry.drainPendingWrites().getSaves()).hasSize(1);
    }

    @Test
    void loadReplacesContentsWithoutPendingWrites() {
        registry.add(listing(9));

        registry.load(List.of(listing(1), listing(2)));

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.drainPendingWrites().isEmpty()).isTrue();
    }

    private static Listing listing(long id) {
        return Listing.builder()
                .listingId(id)
                .itemId(BigInteger.valueOf(id))
                .price(BigInteger.valueOf(1_000))
                .recordedOwner("0x1111111111111111111111111111111111111111")
                .itemRegistryAddress("0x00000000000000000000000000000000000000cc")
                .build();
    }
}
