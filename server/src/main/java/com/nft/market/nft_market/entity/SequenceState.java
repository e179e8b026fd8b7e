package com.nft.market.nft_market.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Last issued listing and order ids, persisted so ids keep growing across
 * restarts even after the listings that used them were deleted.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Document(collection = "sequences")
public class SequenceState {

    public static final String SINGLETON_ID = "marketplace";

    @Id
    private String id;

    private long lastListingId;

    private long lastOrderId;

    public static SequenceState of(long lastListingId, long lastOrderId) {
        return new SequenceState(SINGLETON_ID, lastListingId, lastOrderId);
    }
}
