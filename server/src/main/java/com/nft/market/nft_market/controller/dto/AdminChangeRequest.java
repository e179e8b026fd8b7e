package com.nft.market.nft_market.controller.dto;

import java.math.BigInteger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Body of the admin setters. Each endpoint reads the one field it changes.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class AdminChangeRequest {

    Integer feePercentBps;

    BigInteger minimumFee;

    String admin;
}
