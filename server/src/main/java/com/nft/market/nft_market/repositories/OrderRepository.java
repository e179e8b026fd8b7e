package com.nft.market.nft_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.nft.market.nft_market.entity.Order;

/**
 * Orders as last flushed from the in-memory order book. The order book is the
 * source of truth while the service runs; this collection is what it is
 * rebuilt from on startup.
 */
@Repository
public interface OrderRepository extends MongoRepository<Order, Long> {
}
