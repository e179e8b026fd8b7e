package com.nft.market.nft_market.controller.dto;

import java.math.BigInteger;

import com.nft.market.nft_market.entity.AdminConfig;

import lombok.Value;

@Value
public class FeesResponse {
    int feePercentBps;
    BigInteger minimumFee;
    String admin;

    public static FeesResponse from(AdminConfig config) {
        return new FeesResponse(config.getFeePercentBasisPoints(), config.getMinimumFee(), config.getAdmin());
    }
}
