package com.nft.market.nft_market.external;

import java.math.BigInteger;

/**
 * Registry of unique items and their owners, owned and operated outside the
 * marketplace.
 */
public interface ItemRegistry {

    String address();

    /**
     * @throws ExternalCallException if the item does not exist
     */
    String ownerOf(BigInteger itemId);

    String getApproved(BigInteger itemId);

    boolean isApprovedForAll(String owner, String operator);

    /**
     * Atomic: either the item ends up with {@code to} or nothing changes.
     */
    void safeTransferFrom(String operator, String from, String to, BigInteger itemId);
}
