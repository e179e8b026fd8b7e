package com.nft.market.nft_market.controller.dto;

import java.math.BigInteger;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ListingRequest {

    @NotNull
    BigInteger itemId;

    @NotNull
    BigInteger price;

    @NotBlank
    String registryAddress;

    String metadataUri;
}
