package com.nft.market.nft_market.event;

/**
 * Marker for events the marketplace emits. Events are published only when the
 * request that raised them commits.
 */
public interface MarketplaceEvent {

    default String getType() {
        return getClass().getSimpleName();
    }
}
