package com.nft.market.nft_market.store;

import java.util.List;

import lombok.Value;

/**
 * Committed changes not yet written to the database: entities to save and ids
 * to delete.
 */
@Value
public class PendingWrites<T> {
    List<T> saves;
    List<Long> deletes;

    public boolean isEmpty() {
        return saves.isEmpty() && deletes.isEmpty();
    }
}
