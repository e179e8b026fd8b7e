package com.nft.market.nft_market.service;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import com.nft.market.nft_market.engine.SettlementEngine;
import com.nft.market.nft_market.entity.AdminConfig;
import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Listing;
import com.nft.market.nft_market.entity.Order;
import com.nft.market.nft_market.entity.OrderStatus;
import com.nft.market.nft_market.exception.ErrorCode;
import com.nft.market.nft_market.exception.MarketplaceException;
import com.nft.market.nft_market.execution.MarketplaceExecutor;
import com.nft.market.nft_market.external.TransferReceiver;
import com.nft.market.nft_market.store.ListingRegistry;
import com.nft.market.nft_market.store.OrderBook;

import lombok.RequiredArgsConstructor;

/**
 * Entry point for every marketplace request. Each call runs as one serialized
 * unit of work on the {@link MarketplaceExecutor}.
 *
 * Also the {@link TransferReceiver} the ledger calls back into: a callback
 * made while a purchase is settling joins that purchase's unit, any other
 * callback runs as a request of its own.
 */
@RequiredArgsConstructor
public class MarketplaceService implements TransferReceiver {

    private final MarketplaceExecutor executor;
    private final ListingService listingService;
    private final SettlementEngine settlementEngine;
    private final AdminPolicy adminPolicy;
    private final ListingRegistry listingRegistry;
    private final OrderBook orderBook;

    public long list(String caller, BigInteger itemId, BigInteger price, String registryAddress, String metadataUri) {
        String sender = caller(caller);
        return executor.execute("list",
                () -> listingService.list(sender, itemId, price, registryAddress, metadataUri));
    }

    public long buy(String caller, long listingId) {
        String sender = caller(caller);
        return executor.execute("buy", () -> settlementEngine.buy(sender, listingId));
    }

    @Override
    public void onTransferReceived(String caller, String from, BigInteger amount, byte[] payload) {
        executor.run("onTransferReceived",
                () -> settlementEngine.onTransferReceived(caller, from, amount, payload));
    }

    public Optional<Listing> nftInfo(long listingId) {
        return executor.execute("nftInfo", () -> listingRegistry.find(listingId));
    }

    public List<Listing> activeListings() {
        return executor.execute("listings", listingRegistry::findAll);
    }

    public Optional<Order> orderInfo(long orderId) {
        return executor.execute("orderInfo", () -> orderBook.find(orderId));
    }

    /**
     * Orders matching the optional buyer, seller and status filters.
     */
    public List<Order> findOrders(String buyer, String seller, OrderStatus status) {
        return executor.execute("orders", () -> orderBook.findAll(o ->
                (buyer == null || Addresses.same(buyer, o.getBuyer()))
                        && (seller == null || Addresses.same(seller, o.getSeller()))
                        && (status == null || status == o.getStatus())));
    }

    public AdminConfig fees() {
        return executor.execute("fees", adminPolicy::current);
    }

    public int feePercent() {
        return executor.execute("feePercent", adminPolicy::getFeePercent);
    }

    public BigInteger minimumFee() {
        return executor.execute("minimumFee", adminPolicy::getMinimumFee);
    }

    public void changeFeePercent(String caller, int feePercentBasisPoints) {
        String sender = caller(caller);
        executor.run("changeFeePercent", () -> adminPolicy.changeFeePercent(sender, feePercentBasisPoints));
    }

    public void changeMinimumFee(String caller, BigInteger minimumFee) {
        String sender = caller(caller);
        executor.run("changeMinimumFee", () -> adminPolicy.changeMinimumFee(sender, minimumFee));
    }

    public void setAdmin(String caller, String newAdmin) {
        String sender = caller(caller);
        executor.run("setAdmin", () -> adminPolicy.setAdmin(sender, newAdmin));
    }

    private static String caller(String caller) {
        if (!Addresses.isValid(caller)) {
            throw MarketplaceException.of(ErrorCode.INVALID_ADDRESS, "Invalid caller address: " + caller);
        }
        return Addresses.normalize(caller);
    }
}
