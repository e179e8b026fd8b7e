package com.nft.market.nft_market.service;

import java.math.BigInteger;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Listing;
import com.nft.market.nft_market.external.CallResult;
import com.nft.market.nft_market.external.ExternalCalls;
import com.nft.market.nft_market.external.ItemRegistry;
import com.nft.market.nft_market.external.ItemRegistryDirectory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only checks against item registries: current ownership and operator
 * approval.
 *
 * Approval is probed as an ordered pair of checks. A failing first query
 * counts as "not approved" and the second is tried; a failing second query
 * also counts as "not approved", which the caller reports as NOT_AUTHORIZED.
 */
@Slf4j
@RequiredArgsConstructor
public class OwnershipVerifier {

    private final ItemRegistryDirectory registries;

    public CallResult<String> ownerOf(String registryAddress, BigInteger itemId) {
        ItemRegistry registry = registries.at(registryAddress);
        return ExternalCalls.attempt("ownerOf(" + itemId + ")", () -> registry.ownerOf(itemId));
    }

    /**
     * Compare the listing snapshot with the registry's current answer.
     */
    public OwnershipCheck verify(Listing listing) {
        CallResult<String> owner = ownerOf(listing.getItemRegistryAddress(), listing.getItemId());
        if (owner.isFailure()) {
            return OwnershipCheck.gone(owner.getFailure());
        }
        if (!Addresses.same(owner.getValue(), listing.getRecordedOwner())) {
            return OwnershipCheck.changed(owner.getValue());
        }
        return OwnershipCheck.current(owner.getValue());
    }

    /**
     * May {@code caller} list the item? Single-item approval first, then
     * approval for all of the owner's items.
     */
    public boolean mayList(String registryAddress, BigInteger itemId, String owner, String caller) {
        if (Addresses.same(caller, owner)) {
            return true;
        }
        ItemRegistry registry = registries.at(registryAddress);
        return isApprovedForItem(registry, itemId, caller) || isApprovedForAll(registry, owner, caller);
    }

    /**
     * May {@code operator} move the item on the owner's behalf? Approval for
     * all first, then single-item approval.
     */
    public boolean mayTransfer(Listing listing, String operator) {
        ItemRegistry registry = registries.at(listing.getItemRegistryAddress());
        String owner = listing.getRecordedOwner();
        return isApprovedForAll(registry, owner, operator)
                || isApprovedForItem(registry, listing.getItemId(), operator);
    }

    private boolean isApprovedForItem(ItemRegistry registry, BigInteger itemId, String operator) {
        CallResult<String> approved = ExternalCalls.attempt("getApproved(" + itemId + ")",
                () -> registry.getApproved(itemId));
        if (approved.isFailure()) {
            log.debug("Approval query for item {} failed ({}), treating as not approved",
                    itemId, approved.getFailure());
            return false;
        }
        return Addresses.same(approved.getValue(), operator);
    }

    private boolean isApprovedForAll(ItemRegistry registry, String owner, String operator) {
        CallResult<Boolean> approved = ExternalCalls.attempt("isApprovedForAll(" + owner + ")",
                () -> registry.isApprovedForAll(owner, operator));
        if (approved.isFailure()) {
            log.debug("Operator approval query for owner {} failed ({}), treating as not approved",
                    owner, approved.getFailure());
            return false;
        }
        return Boolean.TRUE.equals(approved.getValue());
    }
}
