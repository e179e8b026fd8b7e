package com.nft.market.nft_market.engine;

import static com.nft.market.nft_market.support.MarketplaceFixture.BUYER;
import static com.nft.market.nft_market.support.MarketplaceFixture.LEDGER;
import static com.nft.market.nft_market.support.MarketplaceFixture.MARKETPLACE;
import static com.nft.market.nft_market.support.MarketplaceFixture.MIN_FEE;
import static com.nft.market.nft_market.support.MarketplaceFixture.OTHER;
import static com.nft.market.nft_market.support.MarketplaceFixture.REGISTRY;
import static com.nft.market.nft_market.support.MarketplaceFixture.SELLER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.nft.market.nft_market.entity.Listing;
import com.nft.market.nft_market.entity.Order;
import com.nft.market.nft_market.entity.OrderStatus;
import com.nft.market.nft_market.entity.Uint256;
import com.nft.market.nft_market.event.ItemNoLongerAvailable;
import com.nft.market.nft_market.event.ItemNoLongerExists;
import com.nft.market.nft_market.event.ItemSold;
import com.nft.market.nft_market.exception.ErrorCode;
import com.nft.market.nft_market.exception.MarketplaceException;
import com.nft.market.nft_market.external.FailureKind;
import com.nft.market.nft_market.support.MarketplaceFixture;

class SettlementEngineTest {

    private static final long ITEM = 7;
    private static final long PRICE = 100_000;
    private static final long FEE = 3_000;

    private MarketplaceFixture market;

    @BeforeEach
    void setUp() {
        market = new MarketplaceFixture();
    }

    @AfterEach
    void tearDown() {
        market.close();
    }

    @Test
    void buySettlesBothLegsAndMovesTheItem() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.fundPurchase(BUYER, SELLER, PRICE, FEE);

        long orderId = market.service.buy(BUYER, listingId);

        Order order = market.service.orderInfo(orderId).orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.FULFILLED);
        assertThat(order.getPlatformFee()).isEqualTo(BigInteger.valueOf(FEE));
        assertThat(order.getSellerAmount()).isEqualTo(BigInteger.valueOf(PRICE - FEE));
        assertThat(order.getCompletedAt()).isNotNull();

        assertThat(market.itemRegistry.ownerOf(BigInteger.valueOf(ITEM))).isEqualTo(BUYER);
        assertThat(market.balance(BUYER)).isEqualTo(BigInteger.ZERO);
        assertThat(market.balance(SELLER)).isEqualTo(BigInteger.valueOf(PRICE - FEE));
        assertThat(market.balance(MARKETPLACE)).isEqualTo(BigInteger.valueOf(FEE));
        assertThat(market.service.nftInfo(listingId)).isEmpty();

        assertThat(market.publishedTypes()).containsExactly("ListingCreated", "OrderPlaced", "ItemSold");
        ItemSold sold = (ItemSold) market.published.get(2);
        assertThat(sold.getOrderId()).isEqualTo(orderId);
        assertThat(sold.getBuyer()).isEqualTo(BUYER);
        assertThat(sold.getSeller()).isEqualTo(SELLER);
    }

    @Test
    void minimumFeeAppliesWhenProportionalFeeIsSmaller() {
        long price = MIN_FEE.longValue() * 2;
        long listingId = market.listApproved(SELLER, ITEM, price);
        market.fundPurchase(BUYER, SELLER, price, MIN_FEE.longValue());

        long orderId = market.service.buy(BUYER, listingId);

        Order order = market.service.orderInfo(orderId).orElseThrow();
        assertThat(order.getPlatformFee()).isEqualTo(MIN_FEE);
        assertThat(order.getSellerAmount()).isEqualTo(MIN_FEE);
        assertThat(market.balance(MARKETPLACE)).isEqualTo(MIN_FEE);
    }

    @Test
    void buyingASoldListingAgainIsRejected() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.fundPurchase(BUYER, SELLER, PRICE, FEE);
        market.service.buy(BUYER, listingId);

        market.fundPurchase(OTHER, SELLER, PRICE, FEE);
        assertThatThrownBy(() -> market.service.buy(OTHER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_LISTING);
    }

    @Test
    void sellerCannotBuyOwnListing() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.fundPurchase(SELLER, SELLER, PRICE, FEE);

        assertThatThrownBy(() -> market.service.buy(SELLER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.SAME_PARTY);
        assertThat(market.orderBook.size()).isZero();
        assertThat(market.service.nftInfo(listingId)).isPresent();
    }

    @Test
    void insufficientBuyerAllowanceAbortsWithoutTrace() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.ledger.mint(BUYER, BigInteger.valueOf(PRICE));
        market.ledger.approve(BUYER, MARKETPLACE, BigInteger.valueOf(PRICE - 1));
        market.ledger.approve(SELLER, MARKETPLACE, BigInteger.valueOf(FEE));
        market.published.clear();

        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_ALLOWANCE);

        assertThat(market.orderBook.size()).isZero();
        assertThat(market.sequenceAllocator.currentOrderId()).isZero();
        assertThat(market.published).isEmpty();
        assertThat(market.service.nftInfo(listingId)).isPresent();
    }

    @Test
    void insufficientSellerAllowanceForFeeIsRejected() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.fundPurchase(BUYER, SELLER, PRICE, FEE - 1);

        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_ALLOWANCE);
        assertThat(market.balance(BUYER)).isEqualTo(BigInteger.valueOf(PRICE));
    }

    @Test
    void insufficientBuyerBalanceIsRejected() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.ledger.mint(BUYER, BigInteger.valueOf(PRICE - 1));
        market.ledger.approve(BUYER, MARKETPLACE, BigInteger.valueOf(PRICE));
        market.ledger.approve(SELLER, MARKETPLACE, BigInteger.valueOf(FEE));

        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
        assertThat(market.orderBook.size()).isZero();
    }

    @Test
    void ownershipDriftRetiresListingPermanently() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.itemRegistry.transferFrom(SELLER, SELLER, OTHER, BigInteger.valueOf(ITEM));
        market.fundPurchase(BUYER, SELLER, PRICE, FEE);
        market.published.clear();

        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.OWNERSHIP_CHANGED);

        assertThat(market.service.nftInfo(listingId)).isEmpty();
        assertThat(market.published).hasSize(1);
        ItemNoLongerAvailable event = (ItemNoLongerAvailable) market.published.get(0);
        assertThat(event.getRecordedOwner()).isEqualTo(SELLER);
        assertThat(event.getCurrentOwner()).isEqualTo(OTHER);

        // the original owner getting the item back does not revive the listing
        market.itemRegistry.transferFrom(OTHER, OTHER, SELLER, BigInteger.valueOf(ITEM));
        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_LISTING);
        assertThat(market.orderBook.size()).isZero();
    }

    @Test
    void burnedItemRetiresListing() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.itemRegistry.burn(SELLER, BigInteger.valueOf(ITEM));
        market.published.clear();

        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.ITEM_NO_LONGER_EXISTS);

        assertThat(market.service.nftInfo(listingId)).isEmpty();
        assertThat(market.published).singleElement().isInstanceOf(ItemNoLongerExists.class);
    }

    @Test
    void priceBelowRaisedMinimumFeeIsRejectedAtBuy() {
        long listingId = market.listApproved(SELLER, ITEM, 2_000);
        market.service.changeMinimumFee(MarketplaceFixture.ADMIN, BigInteger.valueOf(5_000));
        market.fundPurchase(BUYER, SELLER, 2_000, 5_000);

        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_PRICE);
        assertThat(market.service.nftInfo(listingId)).isPresent();
    }

    @Test
    void missingOperatorApprovalFailsInCallbackAndRevertsPayment() {
        market.itemRegistry.mint(SELLER, BigInteger.valueOf(ITEM));
        long listingId = market.service.list(SELLER, BigInteger.valueOf(ITEM), BigInteger.valueOf(PRICE),
                REGISTRY, null);
        market.fundPurchase(BUYER, SELLER, PRICE, FEE);

        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_AUTHORIZED);

        assertThat(market.balance(BUYER)).isEqualTo(BigInteger.valueOf(PRICE));
        assertThat(market.balance(SELLER)).isEqualTo(BigInteger.ZERO);
        assertThat(market.ledger.allowance(BUYER, MARKETPLACE)).isEqualTo(BigInteger.valueOf(PRICE));
        assertThat(market.orderBook.size()).isZero();
    }

    @Test
    void singleItemApprovalIsEnoughToSettle() {
        market.itemRegistry.mint(SELLER, BigInteger.valueOf(ITEM));
        market.itemRegistry.approve(SELLER, MARKETPLACE, BigInteger.valueOf(ITEM));
        long listingId = market.service.list(SELLER, BigInteger.valueOf(ITEM), BigInteger.valueOf(PRICE),
                REGISTRY, null);
        market.fundPurchase(BUYER, SELLER, PRICE, FEE);

        long orderId = market.service.buy(BUYER, listingId);

        assertThat(market.service.orderInfo(orderId).orElseThrow().getStatus()).isEqualTo(OrderStatus.FULFILLED);
        assertThat(market.itemRegistry.ownerOf(BigInteger.valueOf(ITEM))).isEqualTo(BUYER);
    }

    @Test
    void rejectedItemTransferRevertsEverything() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.fundPurchase(BUYER, SELLER, PRICE, FEE);
        market.itemRegistry.rejectIncomingItems(BUYER, true);

        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .satisfies(e -> {
                    MarketplaceException failure = (MarketplaceException) e;
                    assertThat(failure.getErrorCode()).isEqualTo(ErrorCode.EXTERNAL_CALL_REVERTED);
                    assertThat(failure.getCallFailure().getKind()).isEqualTo(FailureKind.REASON);
                });

        assertThat(market.itemRegistry.ownerOf(BigInteger.valueOf(ITEM))).isEqualTo(SELLER);
        assertThat(market.balance(BUYER)).isEqualTo(BigInteger.valueOf(PRICE));
        assertThat(market.service.nftInfo(listingId)).isPresent();
    }

    @Test
    void driftDetectedInCallbackCancelsOrderButCompletesTheRequest() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.fundPurchase(BUYER, SELLER, PRICE, FEE);
        // the seller moves the item away while the fee leg is in flight
        market.ledger.registerReceiver(MARKETPLACE, (caller, from, amount, payload) -> {
            market.itemRegistry.transferFrom(SELLER, SELLER, OTHER, BigInteger.valueOf(ITEM));
            market.service.onTransferReceived(caller, from, amount, payload);
        });

        long orderId = market.service.buy(BUYER, listingId);

        Order order = market.service.orderInfo(orderId).orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getCancellationReason()).isNotBlank();
        assertThat(market.service.nftInfo(listingId)).isEmpty();
        assertThat(market.itemRegistry.ownerOf(BigInteger.valueOf(ITEM))).isEqualTo(OTHER);
        assertThat(market.published).last().isInstanceOf(ItemNoLongerAvailable.class);
    }

    @Test
    void callbackFromUnknownCallerIsRejected() {
        Order pending = seedOrder(OrderStatus.PENDING);

        assertThatThrownBy(() -> market.executor.run("callback", () -> market.settlementEngine.onTransferReceived(
                OTHER, SELLER, pending.getPlatformFee(), OrderPayload.encode(pending.getOrderId()))))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNAUTHORIZED);

        // the cancellation is rolled back with the rejected request
        assertThat(market.orderBook.find(pending.getOrderId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.PENDING);
    }

    @Test
    void callbackForUnknownOrderIsRejected() {
        assertThatThrownBy(() -> market.executor.run("callback", () -> market.settlementEngine.onTransferReceived(
                LEDGER, SELLER, BigInteger.TEN, OrderPayload.encode(42))))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_ORDER);
    }

    @Test
    void callbackWithMalformedPayloadIsRejected() {
        assertThatThrownBy(() -> market.executor.run("callback", () -> market.settlementEngine.onTransferReceived(
                LEDGER, SELLER, BigInteger.TEN, new byte[] { 1, 2, 3 })))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_ORDER);
    }

    @Test
    void callbackForTerminalOrderIsANoOp() {
        Order fulfilled = seedOrder(OrderStatus.FULFILLED);

        market.executor.run("callback", () -> market.settlementEngine.onTransferReceived(
                LEDGER, SELLER, fulfilled.getPlatformFee(), OrderPayload.encode(fulfilled.getOrderId())));

        assertThat(market.orderBook.find(fulfilled.getOrderId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.FULFILLED);
        assertThat(market.published).isEmpty();
    }

    @Test
    void callbackWithWrongAmountIsRejected() {
        Order pending = seedOrder(OrderStatus.PENDING);

        assertThatThrownBy(() -> market.executor.run("callback", () -> market.settlementEngine.onTransferReceived(
                LEDGER, SELLER, pending.getPlatformFee().add(BigInteger.ONE),
                OrderPayload.encode(pending.getOrderId()))))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_ORDER);
    }

    @Test
    void callbackWithWrongSenderIsRejected() {
        Order pending = seedOrder(OrderStatus.PENDING);

        assertThatThrownBy(() -> market.executor.run("callback", () -> market.settlementEngine.onTransferReceived(
                LEDGER, OTHER, pending.getPlatformFee(), OrderPayload.encode(pending.getOrderId()))))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_ORDER);
        assertThat(market.orderBook.find(pending.getOrderId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.PENDING);
    }

    @Test
    void replayedCallbackAfterSettlementChangesNothing() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.fundPurchase(BUYER, SELLER, PRICE, FEE);
        long orderId = market.service.buy(BUYER, listingId);
        market.itemRegistry.transferFrom(BUYER, BUYER, OTHER, BigInteger.valueOf(ITEM));

        market.service.onTransferReceived(LEDGER, SELLER, BigInteger.valueOf(FEE), OrderPayload.encode(orderId));

        assertThat(market.service.orderInfo(orderId).orElseThrow().getStatus()).isEqualTo(OrderStatus.FULFILLED);
        assertThat(market.itemRegistry.ownerOf(BigInteger.valueOf(ITEM))).isEqualTo(OTHER);
        assertThat(market.published).filteredOn(ItemSold.class::isInstance).hasSize(1);
    }

    @Test
    void callbackOutsideAPurchaseSettlesAsItsOwnRequest() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        Order pending = seedOrder(OrderStatus.PENDING);
        market.published.clear();

        market.service.onTransferReceived(LEDGER, SELLER, pending.getPlatformFee(),
                OrderPayload.encode(pending.getOrderId()));

        assertThat(market.orderBook.find(pending.getOrderId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.FULFILLED);
        assertThat(market.itemRegistry.ownerOf(BigInteger.valueOf(ITEM))).isEqualTo(BUYER);
        assertThat(market.service.nftInfo(listingId)).isEmpty();
        assertThat(market.published).singleElement().isInstanceOf(ItemSold.class);
    }

    @Test
    void rejectedCallbackOutsideAPurchaseLeavesTheOrderPending() {
        market.listApproved(SELLER, ITEM, PRICE);
        Order pending = seedOrder(OrderStatus.PENDING);

        assertThatThrownBy(() -> market.service.onTransferReceived(OTHER, SELLER, pending.getPlatformFee(),
                OrderPayload.encode(pending.getOrderId())))
                .isInstanceOf(MarketplaceException.class)
                .extracting(e -> ((MarketplaceException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNAUTHORIZED);

        assertThat(market.orderBook.find(pending.getOrderId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.PENDING);
        assertThat(market.itemRegistry.ownerOf(BigInteger.valueOf(ITEM))).isEqualTo(SELLER);
    }

    @Test
    void arithmeticFaultOnPriceLegRollsBackTheOrder() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.fundPurchase(BUYER, SELLER, PRICE, FEE);
        market.ledger.mint(SELLER, Uint256.MAX);
        market.published.clear();

        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .satisfies(e -> {
                    MarketplaceException failure = (MarketplaceException) e;
                    assertThat(failure.getErrorCode()).isEqualTo(ErrorCode.EXTERNAL_ARITHMETIC_FAULT);
                    assertThat(failure.getCallFailure().getKind()).isEqualTo(FailureKind.ARITHMETIC);
                });

        assertThat(market.orderBook.size()).isZero();
        assertThat(market.balance(BUYER)).isEqualTo(BigInteger.valueOf(PRICE));
        assertThat(market.balance(SELLER)).isEqualTo(Uint256.MAX);
        assertThat(market.ledger.allowance(BUYER, MARKETPLACE)).isEqualTo(BigInteger.valueOf(PRICE));
        assertThat(market.service.nftInfo(listingId)).isPresent();
        assertThat(market.published).isEmpty();
    }

    @Test
    void unexplainedFailureOnFeeLegRollsBackBothLegs() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);
        market.fundPurchase(BUYER, SELLER, PRICE, FEE);
        market.ledger.registerReceiver(MARKETPLACE, (caller, from, amount, payload) -> {
            throw new IllegalStateException("receiver crashed");
        });

        assertThatThrownBy(() -> market.service.buy(BUYER, listingId))
                .isInstanceOf(MarketplaceException.class)
                .satisfies(e -> {
                    MarketplaceException failure = (MarketplaceException) e;
                    assertThat(failure.getErrorCode()).isEqualTo(ErrorCode.EXTERNAL_CALL_FAILED);
                    assertThat(failure.getCallFailure().getKind()).isEqualTo(FailureKind.OPAQUE);
                });

        assertThat(market.orderBook.size()).isZero();
        assertThat(market.balance(BUYER)).isEqualTo(BigInteger.valueOf(PRICE));
        assertThat(market.balance(SELLER)).isEqualTo(BigInteger.ZERO);
        assertThat(market.balance(MARKETPLACE)).isEqualTo(BigInteger.ZERO);
        assertThat(market.itemRegistry.ownerOf(BigInteger.valueOf(ITEM))).isEqualTo(SELLER);
    }

    @Test
    void listingSnapshotReflectsRegistryAtListingTime() {
        long listingId = market.listApproved(SELLER, ITEM, PRICE);

        Listing listing = market.service.nftInfo(listingId).orElseThrow();
        assertThat(listing.getListingId()).isEqualTo(listingId);
        assertThat(listing.getItemId()).isEqualTo(BigInteger.valueOf(ITEM));
        assertThat(listing.getPrice()).isEqualTo(BigInteger.valueOf(PRICE));
        assertThat(listing.getRecordedOwner()).isEqualTo(SELLER);
        assertThat(listing.getItemRegistryAddress()).isEqualTo(REGISTRY);
        assertThat(listing.getMetadataUri()).isEqualTo("ipfs://item/" + ITEM);
    }

    private Order seedOrder(OrderStatus status) {
        Order order = Order.builder()
                .orderId(1L)
                .listingId(1L)
                .itemId(BigInteger.valueOf(ITEM))
                .price(BigInteger.valueOf(PRICE))
                .platformFee(BigInteger.valueOf(FEE))
                .sellerAmount(BigInteger.valueOf(PRICE - FEE))
                .buyer(BUYER)
                .seller(SELLER)
                .status(status)
                .build();
        market.orderBook.add(order);
        return order;
    }
}
