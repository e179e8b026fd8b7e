package com.nft.market.nft_market.config;

import java.time.Clock;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.nft.market.nft_market.engine.FeeSchedule;
import com.nft.market.nft_market.engine.SettlementEngine;
import com.nft.market.nft_market.entity.AdminConfig;
import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.event.EventJournal;
import com.nft.market.nft_market.execution.MarketplaceExecutor;
import com.nft.market.nft_market.external.ItemRegistryDirectory;
import com.nft.market.nft_market.sandbox.InMemoryBalanceLedger;
import com.nft.market.nft_market.sandbox.InMemoryItemRegistry;
import com.nft.market.nft_market.service.AdminPolicy;
import com.nft.market.nft_market.service.ListingService;
import com.nft.market.nft_market.service.MarketplaceService;
import com.nft.market.nft_market.service.OwnershipVerifier;
import com.nft.market.nft_market.store.ListingRegistry;
import com.nft.market.nft_market.store.OrderBook;
import com.nft.market.nft_market.store.SequenceAllocator;

@Configuration
public class MarketConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SequenceAllocator sequenceAllocator() {
        return new SequenceAllocator();
    }

    @Bean
    public ListingRegistry listingRegistry() {
        return new ListingRegistry();
    }

    @Bean
    public OrderBook orderBook() {
        return new OrderBook();
    }

    @Bean
    public AdminPolicy adminPolicy(MarketplaceProperties properties) {
        return new AdminPolicy(AdminConfig.builder()
                .admin(Addresses.normalize(properties.adminAddress()))
                .feePercentBasisPoints(properties.feePercentBps())
                .minimumFee(properties.minimumFee())
                .build());
    }

    @Bean
    FeeSchedule feeSchedule() {
        return new FeeSchedule();
    }

    @Bean
    public MarketplaceExecutor marketplaceExecutor(ApplicationEventPublisher eventPublisher) {
        return new MarketplaceExecutor(eventPublisher);
    }

    @Bean
    public EventJournal eventJournal(Clock clock) {
        return new EventJournal(clock);
    }

    @Bean
    public InMemoryBalanceLedger balanceLedger(MarketplaceProperties properties) {
        return new InMemoryBalanceLedger(properties.ledgerAddress());
    }

    @Bean
    public InMemoryItemRegistry itemRegistry(MarketplaceProperties properties) {
        return new InMemoryItemRegistry(properties.sandbox().itemRegistryAddress());
    }

    @Bean
    public ItemRegistryDirectory itemRegistryDirectory(InMemoryItemRegistry itemRegistry) {
        ItemRegistryDirectory directory = new ItemRegistryDirectory();
        directory.register(itemRegistry);
        return directory;
    }

    @Bean
    public OwnershipVerifier ownershipVerifier(ItemRegistryDirectory itemRegistryDirectory) {
        return new OwnershipVerifier(itemRegistryDirectory);
    }

    @Bean
    public ListingService listingService(ListingRegistry listingRegistry, SequenceAllocator sequenceAllocator,
            AdminPolicy adminPolicy, OwnershipVerifier ownershipVerifier, Clock clock) {
        return new ListingService(listingRegistry, sequenceAllocator, adminPolicy, ownershipVerifier, clock);
    }

    @Bean
    public SettlementEngine settlementEngine(
            MarketplaceProperties properties,
            ListingRegistry listingRegistry,
            OrderBook orderBook,
            SequenceAllocator sequenceAllocator,
            AdminPolicy adminPolicy,
            FeeSchedule feeSchedule,
            OwnershipVerifier ownershipVerifier,
            ItemRegistryDirectory itemRegistryDirectory,
            InMemoryBalanceLedger balanceLedger,
            Clock clock) {
        SettlementEngine engine = new SettlementEngine(listingRegistry, orderBook, sequenceAllocator, adminPolicy,
                feeSchedule, ownershipVerifier, itemRegistryDirectory, balanceLedger,
                properties.address(), properties.ledgerAddress(), clock);
        return engine;
    }

    @Bean
    public MarketplaceService marketplaceService(MarketplaceExecutor executor, ListingService listingService,
            SettlementEngine settlementEngine, AdminPolicy adminPolicy, ListingRegistry listingRegistry,
            OrderBook orderBook, InMemoryBalanceLedger balanceLedger) {
        MarketplaceService service = new MarketplaceService(executor, listingService, settlementEngine, adminPolicy,
                listingRegistry, orderBook);
        balanceLedger.registerReceiver(settlementEngine.getMarketplaceAddress(), service);
        return service;
    }
}
