package com.nft.market.nft_market.event;

import java.math.BigInteger;

import lombok.Value;

/**
 * The listed item changed owner; the listing was removed.
 */
@Value
public class ItemNoLongerAvailable implements MarketplaceEvent {
    long listingId;
    BigInteger itemId;
    String recordedOwner;
    String currentOwner;
}
