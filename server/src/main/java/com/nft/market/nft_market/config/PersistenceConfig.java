package com.nft.market.nft_market.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.mongo.MongoProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import com.mongodb.client.MongoClient;
import com.nft.market.nft_market.MongoStartUpCheck;
import com.nft.market.nft_market.execution.MarketplaceExecutor;
import com.nft.market.nft_market.persistence.StateLoader;
import com.nft.market.nft_market.persistence.StatePersister;
import com.nft.market.nft_market.repositories.AdminConfigRepository;
import com.nft.market.nft_market.repositories.ListingRepository;
import com.nft.market.nft_market.repositories.OrderRepository;
import com.nft.market.nft_market.repositories.SequenceStateRepository;
import com.nft.market.nft_market.service.AdminPolicy;
import com.nft.market.nft_market.store.ListingRegistry;
import com.nft.market.nft_market.store.OrderBook;
import com.nft.market.nft_market.store.SequenceAllocator;

/**
 * MongoDB write-behind for the in-memory stores.
 * Disabled with marketplace.persistence.enabled=false.
 */
@Configuration
@ConditionalOnProperty(prefix = "marketplace.persistence", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class PersistenceConfig {

    @Bean
    MongoStartUpCheck mongoStartUpCheck(MongoClient mongoClient, MongoProperties mongoProperties) {
        return new MongoStartUpCheck(mongoClient, mongoProperties.getMongoClientDatabase());
    }

    @Bean
    @DependsOn("mongoStartUpCheck")
    StateLoader stateLoader(ListingRegistry listingRegistry,
            OrderBook orderBook, AdminPolicy adminPolicy, SequenceAllocator sequenceAllocator,
            ListingRepository listingRepository, OrderRepository orderRepository,
            AdminConfigRepository adminConfigRepository, SequenceStateRepository sequenceStateRepository) {
        return new StateLoader(listingRegistry, orderBook, adminPolicy, sequenceAllocator, listingRepository,
                orderRepository, adminConfigRepository, sequenceStateRepository);
    }

    @Bean
    @DependsOn("stateLoader")
    StatePersister statePersister(MarketplaceExecutor executor,
            ListingRegistry listingRegistry, OrderBook orderBook, AdminPolicy adminPolicy,
            SequenceAllocator sequenceAllocator, ListingRepository listingRepository,
            OrderRepository orderRepository, AdminConfigRepository adminConfigRepository,
            SequenceStateRepository sequenceStateRepository) {
        return new StatePersister(executor, listingRegistry, orderBook, adminPolicy, sequenceAllocator,
                listingRepository, orderRepository, adminConfigRepository, sequenceStateRepository);
    }
}
