package com.nft.market.nft_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.nft.market.nft_market.entity.AdminConfig;

@Repository
public interface AdminConfigRepository extends MongoRepository<AdminConfig, String> {
}
