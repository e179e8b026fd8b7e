package com.nft.market.nft_market.controller;

import java.security.Principal;

import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.nft.market.nft_market.controller.dto.AdminChangeRequest;
import com.nft.market.nft_market.controller.dto.FeesResponse;
import com.nft.market.nft_market.exception.ErrorCode;
import com.nft.market.nft_market.exception.MarketplaceException;
import com.nft.market.nft_market.service.MarketplaceService;

import lombok.RequiredArgsConstructor;

/**
 * Admin setters. The caller must be the current admin; the service enforces it.
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final MarketplaceService marketplaceService;

    @PutMapping("/fee-percent")
    public FeesResponse changeFeePercent(Principal principal, @RequestBody AdminChangeRequest request) {
        if (request.getFeePercentBps() == null) {
            throw MarketplaceException.of(ErrorCode.INVALID_FEE_PERCENT, "feePercentBps is required");
        }
        marketplaceService.changeFeePercent(principal.getName(), request.getFeePercentBps());
        return FeesResponse.from(marketplaceService.fees());
    }

    @PutMapping("/minimum-fee")
    public FeesResponse changeMinimumFee(Principal principal, @RequestBody AdminChangeRequest request) {
        marketplaceService.changeMinimumFee(principal.getName(), request.getMinimumFee());
        return FeesResponse.from(marketplaceService.fees());
    }

    @PutMapping("/admin")
    public FeesResponse setAdmin(Principal principal, @RequestBody AdminChangeRequest request) {
        marketplaceService.setAdmin(principal.getName(), request.getAdmin());
        return FeesResponse.from(marketplaceService.fees());
    }
}
