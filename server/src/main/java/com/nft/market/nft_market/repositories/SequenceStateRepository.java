package com.nft.market.nft_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.nft.market.nft_market.entity.SequenceState;

@Repository
public interface SequenceStateRepository extends MongoRepository<SequenceState, String> {
}
