package com.nft.market.nft_market.event;

import java.math.BigInteger;

import lombok.Value;

/**
 * A new listing was stored.
 */
@Value
public class ListingCreated implements MarketplaceEvent {
    long listingId;
    BigInteger itemId;
    BigInteger price;
    String owner;
    String itemRegistry;
    String metadataUri;
}
