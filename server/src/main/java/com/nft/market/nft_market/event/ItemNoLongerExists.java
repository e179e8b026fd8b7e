package com.nft.market.nft_market.event;

import java.math.BigInteger;

import lombok.Value;

/**
 * The listed item disappeared from its registry; the listing was removed.
 */
@Value
public class ItemNoLongerExists implements MarketplaceEvent {
    long listingId;
    BigInteger itemId;
}
