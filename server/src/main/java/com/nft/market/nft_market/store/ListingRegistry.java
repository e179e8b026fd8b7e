package com.nft.market.nft_market.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Listing;
import com.nft.market.nft_market.execution.UnitOfWork;

import lombok.extern.slf4j.Slf4j;

/**
 * Active listings keyed by listing id.
 *
 * Listings are immutable, so the registry can hand out its own instances.
 * Writes are tracked for the database flusher; a tracked id that is no longer
 * present at flush time is deleted.
 */
@Slf4j
public class ListingRegistry {

    private final Map<Long, Listing> listings = new ConcurrentHashMap<>();
    private final Set<Long> touched = new LinkedHashSet<>();

    public void add(Listing listing) {
        long listingId = listing.getListingId();
        Listing previous = listings.putIfAbsent(listingId, listing);
        if (previous != null) {
            throw new IllegalStateException("Listing id already in use: " + listingId);
        }
        touch(listingId);
        UnitOfWork.onRollback(() -> listings.remove(listingId));
    }

    public Optional<Listing> find(long listingId) {
        return Optional.ofNullable(listings.get(listingId));
    }

    /**
     * Delete a listing. Used whenever settlement finds its snapshot stale or
     * the item has been sold.
     *
     * @return true if the listing was present
     */
    public boolean remove(long listingId) {
        Listing removed = listings.remove(listingId);
        if (removed == null) {
            return false;
        }
        touch(listingId);
        UnitOfWork.onRollback(() -> listings.put(listingId, removed));
        log.debug("Removed listing {}", listingId);
        return true;
    }

    public List<Listing> findAll() {
        List<Listing> all = new ArrayList<>(listings.values());
        all.sort(Comparator.comparing(Listing::getListingId));
        return all;
    }

    public int size() {
        return listings.size();
    }

    /**
     * Replace the contents with persisted listings (startup only).
     */
    public synchronized void load(Collection<Listing> persisted) {
        listings.clear();
        touched.clear();
        persisted.forEach(l -> listings.put(l.getListingId(), l));
    }

    public synchronized PendingWrites<Listing> drainPendingWrites() {
        List<Listing> saves = new ArrayList<>();
        List<Long> deletes = new ArrayList<>();
        for (Long listingId : touched) {
            Listing listing = listings.get(listingId);
            if (listing != null) {
                saves.add(listing);
            } else {
                deletes.add(listingId);
            }
        }
        touched.clear();
        return new PendingWrites<>(saves, deletes);
    }

    /**
     * Mark writes that could not be persisted so the next drain returns them again.
     */
    public synchronized void markPending(PendingWrites<Listing> writes) {
        writes.getSaves().forEach(e -> touched.add(e.getListingId()));
        touched.addAll(writes.getDeletes());
    }

    private synchronized void touch(long listingId) {
        touched.add(listingId);
    }
}
