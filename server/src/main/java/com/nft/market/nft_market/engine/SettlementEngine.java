package com.nft.market.nft_market.engine;

import java.math.BigInteger;
import java.time.Clock;
import java.util.function.Supplier;

import com.nft.market.nft_market.entity.AdminConfig;
import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Listing;
import com.nft.market.nft_market.entity.Order;
import com.nft.market.nft_market.event.ItemNoLongerAvailable;
import com.nft.market.nft_market.event.ItemNoLongerExists;
import com.nft.market.nft_market.event.ItemSold;
import com.nft.market.nft_market.event.OrderPlaced;
import com.nft.market.nft_market.exception.ErrorCode;
import com.nft.market.nft_market.exception.MarketplaceException;
import com.nft.market.nft_market.execution.UnitOfWork;
import com.nft.market.nft_market.external.BalanceLedger;
import com.nft.market.nft_market.external.CallFailure;
import com.nft.market.nft_market.external.CallResult;
import com.nft.market.nft_market.external.ExternalCalls;
import com.nft.market.nft_market.external.ItemRegistryDirectory;
import com.nft.market.nft_market.external.TransferReceiver;
import com.nft.market.nft_market.service.AdminPolicy;
import com.nft.market.nft_market.service.OwnershipCheck;
import com.nft.market.nft_market.service.OwnershipVerifier;
import com.nft.market.nft_market.store.ListingRegistry;
import com.nft.market.nft_market.store.OrderBook;
import com.nft.market.nft_market.store.SequenceAllocator;

import lombok.extern.slf4j.Slf4j;

/**
 * Purchase and settlement.
 *
 * Buy Flow:
 * 1. Load the listing and re-verify item ownership against the registry
 * 2. Validate price and parties, quote the platform fee
 * 3. Record the order as PENDING and emit OrderPlaced
 * 4. Check allowances and buyer balance in the ledger
 * 5. Leg 1: ledger moves the price from buyer to seller
 * 6. Leg 2: ledger moves the fee from seller to the marketplace and calls
 *    back {@link #onTransferReceived} with the order id
 *
 * Callback Flow:
 * 1. Authenticate the ledger, check the order matches the transfer
 * 2. Re-verify ownership and the marketplace's operator approval
 * 3. Registry moves the item from seller to buyer, order becomes FULFILLED
 *
 * Every failing step cancels the pending order before the failure is raised.
 * The marketplace never takes the item: it moves straight from seller to
 * buyer, or stays where it is.
 *
 * Must run inside a unit of work; the callback joins the unit of the buy that
 * triggered it.
 */
@Slf4j
public class SettlementEngine implements TransferReceiver {

    private final ListingRegistry listingRegistry;
    private final OrderBook orderBook;
    private final SequenceAllocator sequenceAllocator;
    private final AdminPolicy adminPolicy;
    private final FeeSchedule feeSchedule;
    private final OwnershipVerifier ownershipVerifier;
    private final ItemRegistryDirectory registries;
    private final BalanceLedger ledger;
    private final String marketplaceAddress;
    private final String ledgerAddress;
    private final Clock clock;

    public SettlementEngine(
            ListingRegistry listingRegistry,
            OrderBook orderBook,
            SequenceAllocator sequenceAllocator,
            AdminPolicy adminPolicy,
            FeeSchedule feeSchedule,
            OwnershipVerifier ownershipVerifier,
            ItemRegistryDirectory registries,
            BalanceLedger ledger,
            String marketplaceAddress,
            String ledgerAddress,
            Clock clock) {
        this.listingRegistry = listingRegistry;
        this.orderBook = orderBook;
        this.sequenceAllocator = sequenceAllocator;
        this.adminPolicy = adminPolicy;
        this.feeSchedule = feeSchedule;
        this.ownershipVerifier = ownershipVerifier;
        this.registries = registries;
        this.ledger = ledger;
        this.marketplaceAddress = Addresses.normalize(marketplaceAddress);
        this.ledgerAddress = Addresses.normalize(ledgerAddress);
        this.clock = clock;
    }

    public String getMarketplaceAddress() {
        return marketplaceAddress;
    }

    // ===== Purchase =====

    public long buy(String caller, long listingId) {
        Listing listing = listingRegistry.find(listingId)
                .orElseThrow(() -> MarketplaceException.forListing(ErrorCode.INVALID_LISTING, listingId,
                        "Listing not found: " + listingId));

        OwnershipCheck ownership = ownershipVerifier.verify(listing);
        if (ownership.isDrifted()) {
            throw retireStaleListing(listing, ownership);
        }

        AdminConfig config = adminPolicy.current();
        if (listing.getPrice().compareTo(config.getMinimumFee()) < 0) {
            throw MarketplaceException.forListing(ErrorCode.INVALID_PRICE, listingId,
                    String.format("Price %s is below the minimum fee %s", listing.getPrice(), config.getMinimumFee()));
        }
        if (Addresses.same(caller, listing.getRecordedOwner())) {
            throw MarketplaceException.forListing(ErrorCode.SAME_PARTY, listingId,
                    "Seller cannot buy their own listing: " + caller);
        }

        FeeSchedule.Quote quote = feeSchedule.quote(listing.getPrice(), config);
        Order order = placeOrder(listing, caller, quote);
        long orderId = order.getOrderId();

        ensureFunds(order);

        CallResult<Boolean> priceLeg = ExternalCalls.attempt("transferFrom(buyer->seller)",
                () -> ledger.transferFrom(marketplaceAddress, order.getBuyer(), order.getSeller(), order.getPrice()));
        if (priceLeg.isFailure() || !Boolean.TRUE.equals(priceLeg.getValue())) {
            throw failOrder(order, failureOf(priceLeg, "price transfer returned false"), "price transfer");
        }

        CallResult<Boolean> feeLeg = ExternalCalls.attempt("transferWithCallback(seller->marketplace)",
                () -> ledger.transferWithCallback(marketplaceAddress, order.getSeller(), marketplaceAddress,
                        order.getPlatformFee(), OrderPayload.encode(orderId)));
        if (feeLeg.isFailure() || !Boolean.TRUE.equals(feeLeg.getValue())) {
            throw failOrder(order, failureOf(feeLeg, "fee transfer returned false"), "fee transfer");
        }

        log.info("Order submitted for settlement: orderId={}, listingId={}, buyer={}, price={}, fee={}",
                orderId, listingId, caller, order.getPrice(), order.getPlatformFee());
        return orderId;
    }

    private Order placeOrder(Listing listing, String buyer, FeeSchedule.Quote quote) {
        long orderId = sequenceAllocator.nextOrderId();
        long now = clock.millis();
        Order order = Order.builder()
                .orderId(orderId)
                .listingId(listing.getListingId())
                .itemId(listing.getItemId())
                .price(quote.getPrice())
                .platformFee(quote.getPlatformFee())
                .sellerAmount(quote.getSellerAmount())
                .buyer(Addresses.normalize(buyer))
                .seller(listing.getRecordedOwner())
                .createdAt(now)
                .updatedAt(now)
                .build();
        orderBook.add(order);
        UnitOfWork.emit(new OrderPlaced(orderId, listing.getListingId(), order.getBuyer(), order.getSeller(),
                order.getPrice(), order.getPlatformFee()));
        log.info("Order placed: orderId={}, listingId={}, buyer={}, seller={}, price={}, fee={}, sellerAmount={}",
                orderId, listing.getListingId(), order.getBuyer(), order.getSeller(),
                order.getPrice(), order.getPlatformFee(), order.getSellerAmount());
        return order;
    }

    /**
     * Buyer must have delegated the price, seller the fee, and the buyer must
     * hold the price.
     */
    private void ensureFunds(Order order) {
        BigInteger buyerAllowance = ledgerView(order, "allowance(buyer)",
                () -> ledger.allowance(order.getBuyer(), marketplaceAddress));
        if (buyerAllowance.compareTo(order.getPrice()) < 0) {
            throw insufficient(order, ErrorCode.INSUFFICIENT_ALLOWANCE,
                    String.format("Buyer allowance %s is below price %s", buyerAllowance, order.getPrice()));
        }
        BigInteger sellerAllowance = ledgerView(order, "allowance(seller)",
                () -> ledger.allowance(order.getSeller(), marketplaceAddress));
        if (sellerAllowance.compareTo(order.getPlatformFee()) < 0) {
            throw insufficient(order, ErrorCode.INSUFFICIENT_ALLOWANCE,
                    String.format("Seller allowance %s is below platform fee %s",
                            sellerAllowance, order.getPlatformFee()));
        }
        BigInteger buyerBalance = ledgerView(order, "balanceOf(buyer)", () -> ledger.balanceOf(order.getBuyer()));
        if (buyerBalance.compareTo(order.getPrice()) < 0) {
            throw insufficient(order, ErrorCode.INSUFFICIENT_BALANCE,
                    String.format("Buyer balance %s is below price %s", buyerBalance, order.getPrice()));
        }
    }

    private BigInteger ledgerView(Order order, String operation, Supplier<BigInteger> query) {
        CallResult<BigInteger> result = ExternalCalls.attempt(operation, query);
        if (result.isFailure()) {
            throw failOrder(order, result.getFailure(), operation);
        }
        return result.getValue();
    }

    private MarketplaceException insufficient(Order order, ErrorCode code, String message) {
        cancelIfPending(order.getOrderId(), message);
        log.warn("Order {} rejected: {}", order.getOrderId(), message);
        return MarketplaceException.forOrder(code, order.getListingId(), order.getOrderId(), message);
    }

    // ===== Ledger callback =====

    @Override
    public void onTransferReceived(String caller, String from, BigInteger amount, byte[] payload) {
        long orderId;
        try {
            orderId = OrderPayload.decode(payload);
        } catch (IllegalArgumentException e) {
            throw MarketplaceException.of(ErrorCode.INVALID_ORDER, "Undecodable callback payload: " + e.getMessage());
        }
        Order order = orderBook.find(orderId)
                .orElseThrow(() -> MarketplaceException.forOrder(ErrorCode.INVALID_ORDER, null, orderId,
                        "Order not found: " + orderId));

        if (!Addresses.same(caller, ledgerAddress)) {
            cancelIfPending(orderId, "callback from unauthorized caller " + caller);
            throw MarketplaceException.forOrder(ErrorCode.UNAUTHORIZED, order.getListingId(), orderId,
                    "Callback caller " + caller + " is not the ledger");
        }
        if (!order.isPending()) {
            log.info("Callback for order {} ignored, already {}", orderId, order.getStatus());
            return;
        }
        if (!Addresses.same(from, order.getSeller())
                || amount == null || amount.compareTo(order.getPlatformFee()) != 0
                || Addresses.isZero(order.getBuyer())) {
            String reason = String.format("callback (from=%s, amount=%s) does not match order (seller=%s, fee=%s)",
                    from, amount, order.getSeller(), order.getPlatformFee());
            cancelIfPending(orderId, reason);
            throw MarketplaceException.forOrder(ErrorCode.INVALID_ORDER, order.getListingId(), orderId, reason);
        }

        Listing listing = listingRegistry.find(order.getListingId()).orElse(null);
        if (listing == null) {
            cancelIfPending(orderId, "listing no longer active");
            throw MarketplaceException.forOrder(ErrorCode.INVALID_LISTING, order.getListingId(), orderId,
                    "Listing not found: " + order.getListingId());
        }

        OwnershipCheck ownership = ownershipVerifier.verify(listing);
        if (ownership.isDrifted()) {
            cancelIfPending(orderId, "listing went stale before the item moved");
            retireStaleListing(listing, ownership);
            return;
        }

        if (!ownershipVerifier.mayTransfer(listing, marketplaceAddress)) {
            String reason = "marketplace is not approved to move item " + listing.getItemId();
            cancelIfPending(orderId, reason);
            throw MarketplaceException.forOrder(ErrorCode.NOT_AUTHORIZED, listing.getListingId(), orderId,
                    "Seller " + listing.getRecordedOwner() + " has not approved the marketplace for item "
                            + listing.getItemId());
        }

        CallResult<Void> itemTransfer = ExternalCalls.attemptRun("safeTransferFrom(seller->buyer)",
                () -> registries.at(listing.getItemRegistryAddress()).safeTransferFrom(
                        marketplaceAddress, listing.getRecordedOwner(), order.getBuyer(), listing.getItemId()));
        if (itemTransfer.isFailure()) {
            throw failOrder(order, itemTransfer.getFailure(), "item transfer");
        }

        listingRegistry.remove(listing.getListingId());
        orderBook.update(orderId, o -> o.fulfill(clock.millis()));
        UnitOfWork.emit(new ItemSold(orderId, listing.getListingId(), listing.getItemId(),
                order.getBuyer(), order.getSeller(), order.getPrice()));
        log.info("Item sold: orderId={}, listingId={}, itemId={}, buyer={}, seller={}, price={}",
                orderId, listing.getListingId(), listing.getItemId(), order.getBuyer(), order.getSeller(),
                order.getPrice());
    }

    // ===== Shared =====

    /**
     * Remove a listing whose snapshot no longer matches the registry and emit
     * the matching event.
     *
     * @return the failure {@link #buy} reports for it
     */
    private MarketplaceException retireStaleListing(Listing listing, OwnershipCheck ownership) {
        long listingId = listing.getListingId();
        listingRegistry.remove(listingId);
        if (ownership.getStatus() == OwnershipCheck.Status.ITEM_GONE) {
            UnitOfWork.emit(new ItemNoLongerExists(listingId, listing.getItemId()));
            log.warn("Listing {} removed: item {} no longer exists ({})",
                    listingId, listing.getItemId(), ownership.getFailure());
            return MarketplaceException.forListing(ErrorCode.ITEM_NO_LONGER_EXISTS, listingId,
                    "Item " + listing.getItemId() + " no longer exists");
        }
        UnitOfWork.emit(new ItemNoLongerAvailable(listingId, listing.getItemId(),
                listing.getRecordedOwner(), ownership.getCurrentOwner()));
        log.warn("Listing {} removed: item {} moved from {} to {}",
                listingId, listing.getItemId(), listing.getRecordedOwner(), ownership.getCurrentOwner());
        return MarketplaceException.forListing(ErrorCode.OWNERSHIP_CHANGED, listingId,
                String.format("Item %s is now owned by %s, not %s",
                        listing.getItemId(), ownership.getCurrentOwner(), listing.getRecordedOwner()));
    }

    /**
     * Cancel the order and build the failure to raise. A marketplace error
     * raised by our own callback inside the failed call is re-raised as is.
     */
    private MarketplaceException failOrder(Order order, CallFailure failure, String operation) {
        cancelIfPending(order.getOrderId(), operation + " " + failure.describe());
        log.warn("Order {} failed at {}: {}", order.getOrderId(), operation, failure.describe());
        return failure.nestedMarketplaceError()
                .orElseGet(() -> MarketplaceException.external(failure, order.getListingId(), order.getOrderId(),
                        operation));
    }

    private void cancelIfPending(long orderId, String reason) {
        orderBook.find(orderId)
                .filter(Order::isPending)
                .ifPresent(o -> {
                    orderBook.update(orderId, pending -> pending.cancel(reason, clock.millis()));
                    log.info("Order cancelled: orderId={}, reason={}", orderId, reason);
                });
    }

    private static <T> CallFailure failureOf(CallResult<T> result, String falseReason) {
        return result.isFailure() ? result.getFailure() : CallFailure.rejected(falseReason);
    }
}
