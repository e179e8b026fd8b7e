package com.nft.market.nft_market.service;

import java.math.BigInteger;
import java.time.Clock;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Listing;
import com.nft.market.nft_market.entity.Uint256;
import com.nft.market.nft_market.event.ListingCreated;
import com.nft.market.nft_market.exception.ErrorCode;
import com.nft.market.nft_market.exception.MarketplaceException;
import com.nft.market.nft_market.execution.UnitOfWork;
import com.nft.market.nft_market.external.CallFailure;
import com.nft.market.nft_market.external.CallResult;
import com.nft.market.nft_market.external.FailureKind;
import com.nft.market.nft_market.store.ListingRegistry;
import com.nft.market.nft_market.store.SequenceAllocator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates listings.
 *
 * Listing Flow:
 * 1. Validate registry address and price
 * 2. Ask the registry who owns the item
 * 3. Check the caller is the owner or an approved operator
 * 4. Store the snapshot under a fresh id and emit ListingCreated
 *
 * Must run inside a unit of work.
 */
@Slf4j
@RequiredArgsConstructor
public class ListingService {

    private final ListingRegistry listingRegistry;
    private final SequenceAllocator sequenceAllocator;
    private final AdminPolicy adminPolicy;
    private final OwnershipVerifier ownershipVerifier;
    private final Clock clock;

    public long list(String caller, BigInteger itemId, BigInteger price, String registryAddress, String metadataUri) {
        if (!Addresses.isValid(registryAddress) || Addresses.isZero(Addresses.normalize(registryAddress))) {
            throw MarketplaceException.of(ErrorCode.INVALID_REGISTRY, "Invalid item registry: " + registryAddress);
        }
        String registry = Addresses.normalize(registryAddress);
        if (!Uint256.isValid(itemId)) {
            throw MarketplaceException.of(ErrorCode.ITEM_NOT_FOUND, "Item id out of range: " + itemId);
        }
        BigInteger minimumFee = adminPolicy.getMinimumFee();
        if (!Uint256.isValid(price) || price.compareTo(minimumFee) < 0) {
            throw MarketplaceException.of(ErrorCode.INVALID_PRICE,
                    String.format("Price %s is below the minimum fee %s", price, minimumFee));
        }

        CallResult<String> owner = ownershipVerifier.ownerOf(registry, itemId);
        if (owner.isFailure()) {
            throw lookupFailure(owner.getFailure(), itemId);
        }
        if (!Addresses.isValid(owner.getValue())) {
            throw MarketplaceException.of(ErrorCode.EXTERNAL_CALL_FAILED,
                    String.format("ownerOf(%s) returned a malformed owner: %s", itemId, owner.getValue()));
        }
        String recordedOwner = Addresses.normalize(owner.getValue());
        if (Addresses.isZero(recordedOwner)) {
            throw MarketplaceException.of(ErrorCode.ITEM_NOT_FOUND, "Item " + itemId + " has no owner");
        }

        if (!ownershipVerifier.mayList(registry, itemId, recordedOwner, caller)) {
            log.warn("Listing rejected: {} may not list item {} owned by {}", caller, itemId, recordedOwner);
            throw MarketplaceException.of(ErrorCode.NOT_AUTHORIZED,
                    String.format("Caller %s is not owner or operator of item %s", caller, itemId));
        }

        long listingId = sequenceAllocator.nextListingId();
        Listing listing = Listing.builder()
                .listingId(listingId)
                .itemId(itemId)
                .price(price)
                .recordedOwner(recordedOwner)
                .itemRegistryAddress(registry)
                .metadataUri(metadataUri)
                .createdAt(clock.millis())
                .build();
        listingRegistry.add(listing);
        UnitOfWork.emit(new ListingCreated(listingId, itemId, price, recordedOwner, registry, metadataUri));

        log.info("Listing created: listingId={}, itemId={}, price={}, owner={}, registry={}",
                listingId, itemId, price, recordedOwner, registry);
        return listingId;
    }

    private MarketplaceException lookupFailure(CallFailure failure, BigInteger itemId) {
        String operation = "ownerOf(" + itemId + ")";
        if (failure.getKind() == FailureKind.REASON) {
            return MarketplaceException.withFailure(ErrorCode.ITEM_NOT_FOUND, failure, null, null, operation);
        }
        return MarketplaceException.external(failure, null, null, operation);
    }
}
