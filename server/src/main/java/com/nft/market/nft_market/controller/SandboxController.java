package com.nft.market.nft_market.controller;

import java.math.BigInteger;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.nft.market.nft_market.controller.dto.SandboxRequest;
import com.nft.market.nft_market.execution.MarketplaceExecutor;
import com.nft.market.nft_market.sandbox.InMemoryBalanceLedger;
import com.nft.market.nft_market.sandbox.InMemoryItemRegistry;
import com.nft.market.nft_market.security.JwtUtil;

import lombok.RequiredArgsConstructor;

/**
 * Drives the in-process ledger and item registry so the marketplace can be
 * exercised end to end without a chain. Mutations run on the marketplace
 * executor like any other request.
 */
@RestController
@RequestMapping("/sandbox")
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "marketplace.sandbox", name = "enabled", havingValue = "true")
public class SandboxController {

    private final MarketplaceExecutor executor;
    private final InMemoryBalanceLedger ledger;
    private final InMemoryItemRegistry itemRegistry;
    private final JwtUtil jwtUtil;

    @PostMapping("/token")
    public Map<String, Object> token(@RequestBody SandboxRequest request) {
        return Map.of("token", jwtUtil.generateToken(request.getAccount()));
    }

    @PostMapping("/ledger/mint")
    public Map<String, Object> mintBalance(@RequestBody SandboxRequest request) {
        executor.run("sandbox-mint-balance", () -> ledger.mint(request.getAccount(), request.getAmount()));
        return balance(request.getAccount());
    }

    /**
     * account grants counterparty an allowance of amount.
     */
    @PostMapping("/ledger/approve")
    public Map<String, Object> approveSpending(@RequestBody SandboxRequest request) {
        executor.run("sandbox-approve-spending",
                () -> ledger.approve(request.getAccount(), request.getCounterparty(), request.getAmount()));
        return Map.of("owner", request.getAccount(), "spender", request.getCounterparty(),
                "allowance", executor.execute("sandbox-allowance",
                        () -> ledger.allowance(request.getAccount(), request.getCounterparty())));
    }

    @GetMapping("/ledger/balances/{account}")
    public Map<String, Object> balance(@PathVariable String account) {
        return Map.of("account", account,
                "balance", executor.execute("sandbox-balance", () -> ledger.balanceOf(account)));
    }

    @PostMapping("/items/mint")
    public Map<String, Object> mintItem(@RequestBody SandboxRequest request) {
        executor.run("sandbox-mint-item", () -> itemRegistry.mint(request.getAccount(), request.getItemId()));
        return owner(request.getItemId());
    }

    @PostMapping("/items/burn")
    public Map<String, Object> burnItem(@RequestBody SandboxRequest request) {
        executor.run("sandbox-burn-item", () -> itemRegistry.burn(request.getAccount(), request.getItemId()));
        return Map.of("itemId", request.getItemId(), "burned", true);
    }

    @PostMapping("/items/transfer")
    public Map<String, Object> transferItem(@RequestBody SandboxRequest request) {
        executor.run("sandbox-transfer-item", () -> itemRegistry.transferFrom(request.getAccount(),
                request.getAccount(), request.getCounterparty(), request.getItemId()));
        return owner(request.getItemId());
    }

    /**
     * account approves counterparty for the single item.
     */
    @PostMapping("/items/approve")
    public Map<String, Object> approveItem(@RequestBody SandboxRequest request) {
        executor.run("sandbox-approve-item",
                () -> itemRegistry.approve(request.getAccount(), request.getCounterparty(), request.getItemId()));
        return Map.of("itemId", request.getItemId(), "approved", request.getCounterparty());
    }

    @PostMapping("/items/approval-for-all")
    public Map<String, Object> approveOperator(@RequestBody SandboxRequest request) {
        boolean approved = !Boolean.FALSE.equals(request.getApproved());
        executor.run("sandbox-approval-for-all",
                () -> itemRegistry.setApprovalForAll(request.getAccount(), request.getCounterparty(), approved));
        return Map.of("owner", request.getAccount(), "operator", request.getCounterparty(), "approved", approved);
    }

    @PostMapping("/items/reject-incoming")
    public Map<String, Object> rejectIncoming(@RequestBody SandboxRequest request) {
        boolean reject = !Boolean.FALSE.equals(request.getApproved());
        executor.run("sandbox-reject-incoming", () -> itemRegistry.rejectIncomingItems(request.getAccount(), reject));
        return Map.of("account", request.getAccount(), "rejecting", reject);
    }

    @GetMapping("/items/{itemId}/owner")
    public Map<String, Object> owner(@PathVariable BigInteger itemId) {
        return Map.of("itemId", itemId, "owner", executor.execute("sandbox-owner", () -> itemRegistry.ownerOf(itemId)));
    }
}
