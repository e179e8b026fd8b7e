package com.nft.market.nft_market.persistence;

import java.util.List;

import com.nft.market.nft_market.entity.AdminConfig;
import com.nft.market.nft_market.entity.Listing;
import com.nft.market.nft_market.entity.Order;
import com.nft.market.nft_market.entity.SequenceState;
import com.nft.market.nft_market.repositories.AdminConfigRepository;
import com.nft.market.nft_market.repositories.ListingRepository;
import com.nft.market.nft_market.repositories.OrderRepository;
import com.nft.market.nft_market.repositories.SequenceStateRepository;
import com.nft.market.nft_market.service.AdminPolicy;
import com.nft.market.nft_market.store.ListingRegistry;
import com.nft.market.nft_market.store.OrderBook;
import com.nft.market.nft_market.store.SequenceAllocator;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rebuilds the in-memory stores from MongoDB before the service accepts
 * requests.
 */
@Slf4j
@RequiredArgsConstructor
public class StateLoader {

    private final ListingRegistry listingRegistry;
    private final OrderBook orderBook;
    private final AdminPolicy adminPolicy;
    private final SequenceAllocator sequenceAllocator;
    private final ListingRepository listingRepository;
    private final OrderRepository orderRepository;
    private final AdminConfigRepository adminConfigRepository;
    private final SequenceStateRepository sequenceStateRepository;

    @PostConstruct
    public void load() {
        List<Listing> listings = listingRepository.findAll();
        List<Order> orders = orderRepository.findAll();
        listingRegistry.load(listings);
        orderBook.load(orders);

        long lastListingId = listings.stream().mapToLong(Listing::getListingId).max().orElse(0);
        lastListingId = Math.max(lastListingId, orders.stream().mapToLong(Order::getListingId).max().orElse(0));
        long lastOrderId = orders.stream().mapToLong(Order::getOrderId).max().orElse(0);
        SequenceState sequences = sequenceStateRepository.findById(SequenceState.SINGLETON_ID).orElse(null);
        if (sequences != null) {
            lastListingId = Math.max(lastListingId, sequences.getLastListingId());
            lastOrderId = Math.max(lastOrderId, sequences.getLastOrderId());
        }
        sequenceAllocator.restore(lastListingId, lastOrderId);

        AdminConfig persisted = adminConfigRepository.findById(AdminConfig.SINGLETON_ID).orElse(null);
        if (persisted != null) {
            adminPolicy.load(persisted);
        } else {
            // first start: keep the configured defaults and persist them
            adminPolicy.markPending();
        }

        log.info("Loaded marketplace state: {} listings, {} orders, next listing id {}, next order id {}",
                listings.size(), orders.size(), lastListingId + 1, lastOrderId + 1);
    }
}
