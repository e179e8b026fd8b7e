package com.nft.market.nft_market.service;

import com.nft.market.nft_market.external.CallFailure;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of comparing a listing's recorded owner with the registry.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OwnershipCheck {

    public enum Status {
        CURRENT,
        ITEM_GONE,
        OWNER_CHANGED
    }

    private final Status status;
    private final String currentOwner;
    private final CallFailure failure;

    static OwnershipCheck current(String owner) {
        return new OwnershipCheck(Status.CURRENT, owner, null);
    }

    static OwnershipCheck gone(CallFailure failure) {
        return new OwnershipCheck(Status.ITEM_GONE, null, failure);
    }

    static OwnershipCheck changed(String currentOwner) {
        return new OwnershipCheck(Status.OWNER_CHANGED, currentOwner, null);
    }

    public boolean isDrifted() {
        return status != Status.CURRENT;
    }
}
