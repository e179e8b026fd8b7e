package com.nft.market.nft_market.controller;

import java.security.Principal;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.nft.market.nft_market.controller.dto.FeesResponse;
import com.nft.market.nft_market.controller.dto.ListingRequest;
import com.nft.market.nft_market.entity.Listing;
import com.nft.market.nft_market.entity.Order;
import com.nft.market.nft_market.entity.OrderStatus;
import com.nft.market.nft_market.event.EventJournal;
import com.nft.market.nft_market.service.MarketplaceService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
public class MarketplaceController {

    static final int DEFAULT_EVENT_LIMIT = 100;

    private final MarketplaceService marketplaceService;
    private final EventJournal eventJournal;

    @PostMapping("/listings")
    public ResponseEntity<Map<String, Object>> list(Principal principal, @Valid @RequestBody ListingRequest request) {
        long listingId = marketplaceService.list(principal.getName(), request.getItemId(), request.getPrice(),
                request.getRegistryAddress(), request.getMetadataUri());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("listingId", listingId));
    }

    @GetMapping("/listings")
    public List<Listing> listings() {
        return marketplaceService.activeListings();
    }

    @GetMapping("/listings/{listingId}")
    public ResponseEntity<Listing> nftInfo(@PathVariable long listingId) {
        return ResponseEntity.of(marketplaceService.nftInfo(listingId));
    }

    @PostMapping("/listings/{listingId}/buy")
    public ResponseEntity<Map<String, Object>> buy(Principal principal, @PathVariable long listingId) {
        long orderId = marketplaceService.buy(principal.getName(), listingId);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("orderId", orderId));
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<Order> orderInfo(@PathVariable long orderId) {
        return ResponseEntity.of(marketplaceService.orderInfo(orderId));
    }

    @GetMapping("/orders")
    public List<Order> orders(
            @RequestParam(required = false) String buyer,
            @RequestParam(required = false) String seller,
            @RequestParam(required = false) OrderStatus status) {
        return marketplaceService.findOrders(buyer, seller, status);
    }

    @GetMapping("/fees")
    public FeesResponse fees() {
        return FeesResponse.from(marketplaceService.fees());
    }

    @GetMapping("/events")
    public List<EventJournal.Entry> events(@RequestParam(defaultValue = "" + DEFAULT_EVENT_LIMIT) int limit) {
        return eventJournal.recent(limit);
    }
}
