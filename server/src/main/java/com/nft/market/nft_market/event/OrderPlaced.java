package com.nft.market.nft_market.event;

import java.math.BigInteger;

import lombok.Value;

/**
 * An order was recorded as pending.
 */
@Value
public class OrderPlaced implements MarketplaceEvent {
    long orderId;
    long listingId;
    String buyer;
    String seller;
    BigInteger price;
    BigInteger platformFee;
}
