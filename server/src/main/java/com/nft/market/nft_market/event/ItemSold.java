package com.nft.market.nft_market.event;

import java.math.BigInteger;

import lombok.Value;

/**
 * The item reached the buyer and the order is fulfilled.
 */
@Value
public class ItemSold implements MarketplaceEvent {
    long orderId;
    long listingId;
    BigInteger itemId;
    String buyer;
    String seller;
    BigInteger price;
}
