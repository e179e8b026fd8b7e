package com.nft.market.nft_market.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import com.nft.market.nft_market.entity.Order;
import com.nft.market.nft_market.entity.OrderStatus;
import com.nft.market.nft_market.execution.UnitOfWork;

class OrderBookTest {

    private final OrderBook orderBook = new OrderBook();

    @Test
    void storedOrdersAreIsolatedFromCallers() {
        Order order = order(1);
        orderBook.add(order);

        order.cancel("outside", 1);
        orderBook.find(1).orElseThrow().fulfill(2);

        assertThat(orderBook.find(1).orElseThrow().getStatus()).isEqualTo(OrderStatus.PENDING);
    }

    @Test
    void updateAppliesChangeAndIsUndoneOnRollback() {
        orderBook.add(order(1));
        UnitOfWork unit = UnitOfWork.begin("test");

        Order cancelled = orderBook.update(1, o -> o.cancel("no funds", 10));
        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);

        unit.rollback();

        Order restored = orderBook.find(1).orElseThrow();
        assertThat(restored.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(restored.getCancellationReason()).isNull();
    }

    @Test
    void updatingUnknownOrderFails() {
        assertThatThrownBy(() -> orderBook.update(5, o -> o.fulfill(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findAllFiltersAndSorts() {
        orderBook.add(order(2));
        orderBook.add(order(1));
        orderBook.update(2, o -> o.fulfill(5));

        assertThat(orderBook.findAll(Order::isPending)).extracting(Order::getOrderId).containsExactly(1L);
        assertThat(orderBook.findAll(o -> true)).extracting(Order::getOrderId).containsExactly(1L, 2L);
    }

    @Test
    void drainReturnsTouchedOrdersOnce() {
        orderBook.add(order(1));
        orderBook.update(1, o -> o.fulfill(5));

        assertThat(orderBook.drainPendingWrites().getSaves()).singleElement()
                .extracting(Order::getStatus).isEqualTo(OrderStatus.FULFILLED);
        assertThat(orderBook.drainPendingWrites().isEmpty()).isTrue();
    }

    private static Order order(long id) {
        return Order.builder()
                .orderId(id)
                .listingId(1L)
                .itemId(BigInteger.ONE)
                .price(BigInteger.valueOf(2_000))
                .platformFee(BigInteger.valueOf(1_000))
                .sellerAmount(BigInteger.valueOf(1_000))
                .buyer("0x2222222222222222222222222222222222222222")
                .seller("0x1111111111111111111111111111111111111111")
                .build();
    }
}
