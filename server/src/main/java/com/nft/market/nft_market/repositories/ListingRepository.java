package com.nft.market.nft_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.nft.market.nft_market.entity.Listing;

@Repository
public interface ListingRepository extends MongoRepository<Listing, Long> {
}
