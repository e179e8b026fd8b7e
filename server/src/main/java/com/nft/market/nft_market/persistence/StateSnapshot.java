package com.nft.market.nft_market.persistence;

import java.util.Optional;

import com.nft.market.nft_market.entity.AdminConfig;
import com.nft.market.nft_market.entity.Listing;
import com.nft.market.nft_market.entity.Order;
import com.nft.market.nft_market.entity.SequenceState;
import com.nft.market.nft_market.store.PendingWrites;

import lombok.Value;

/**
 * Committed changes drained from the stores in one pass.
 */
@Value
class StateSnapshot {
    PendingWrites<Listing> listings;
    PendingWrites<Order> orders;
    Optional<AdminConfig> adminConfig;
    SequenceState sequences;

    boolean isEmpty() {
        return listings.isEmpty() && orders.isEmpty() && adminConfig.isEmpty();
    }
}
