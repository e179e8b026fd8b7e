package com.nft.market.nft_market.persistence;

import org.springframework.scheduling.annotation.Scheduled;

import com.nft.market.nft_market.entity.SequenceState;
import com.nft.market.nft_market.execution.MarketplaceExecutor;
import com.nft.market.nft_market.repositories.AdminConfigRepository;
import com.nft.market.nft_market.repositories.ListingRepository;
import com.nft.market.nft_market.repositories.OrderRepository;
import com.nft.market.nft_market.repositories.SequenceStateRepository;
import com.nft.market.nft_market.service.AdminPolicy;
import com.nft.market.nft_market.store.ListingRegistry;
import com.nft.market.nft_market.store.OrderBook;
import com.nft.market.nft_market.store.SequenceAllocator;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Write-behind of committed marketplace state to MongoDB.
 *
 * The drain runs on the marketplace executor, between requests, so it only
 * ever sees committed state. The database writes happen afterwards on the
 * scheduler thread. If a write fails the drained ids are marked again and
 * retried on the next flush.
 */
@Slf4j
@RequiredArgsConstructor
public class StatePersister {

    private final MarketplaceExecutor executor;
    private final ListingRegistry listingRegistry;
    private final OrderBook orderBook;
    private final AdminPolicy adminPolicy;
    private final SequenceAllocator sequenceAllocator;
    private final ListingRepository listingRepository;
    private final OrderRepository orderRepository;
    private final AdminConfigRepository adminConfigRepository;
    private final SequenceStateRepository sequenceStateRepository;

    @Scheduled(fixedDelayString = "${marketplace.persistence.flush-interval-ms:1000}")
    public void flush() {
        StateSnapshot snapshot = executor.execute("flush", () -> new StateSnapshot(
                listingRegistry.drainPendingWrites(),
                orderBook.drainPendingWrites(),
                adminPolicy.drainPendingWrite(),
                SequenceState.of(sequenceAllocator.currentListingId(), sequenceAllocator.currentOrderId())));
        if (snapshot.isEmpty()) {
            return;
        }
        write(snapshot);
    }

    void write(StateSnapshot snapshot) {
        try {
            sequenceStateRepository.save(snapshot.getSequences());
            listingRepository.saveAll(snapshot.getListings().getSaves());
            listingRepository.deleteAllById(snapshot.getListings().getDeletes());
            orderRepository.saveAll(snapshot.getOrders().getSaves());
            orderRepository.deleteAllById(snapshot.getOrders().getDeletes());
            snapshot.getAdminConfig().ifPresent(adminConfigRepository::save);
            log.debug("Persisted {} listings, {} listing deletions, {} orders",
                    snapshot.getListings().getSaves().size(),
                    snapshot.getListings().getDeletes().size(),
                    snapshot.getOrders().getSaves().size());
        } catch (RuntimeException e) {
            log.error("Failed to persist marketplace state, will retry: {}", e.getMessage(), e);
            executor.run("requeue", () -> {
                listingRegistry.markPending(snapshot.getListings());
                orderBook.markPending(snapshot.getOrders());
                snapshot.getAdminConfig().ifPresent(c -> adminPolicy.markPending());
            });
        }
    }

    @PreDestroy
    public void flushOnShutdown() {
        log.info("Flushing marketplace state before shutdown");
        flush();
    }
}
