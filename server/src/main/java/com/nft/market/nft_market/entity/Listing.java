package com.nft.market.nft_market.entity;

import java.math.BigInteger;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * An item offered for sale.
 *
 * IMPORTANT: recordedOwner is the registry's answer at listing time, not a
 * live fact. It is re-verified against the registry before any value moves.
 * Listings are immutable; a stale one is deleted, never edited.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "listings")
public class Listing {

    @Id
    private Long listingId;

    @Indexed
    private BigInteger itemId;

    private BigInteger price;

    @Indexed
    private String recordedOwner;

    private String itemRegistryAddress;

    private String metadataUri;

    private long createdAt;
}
