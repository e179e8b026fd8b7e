package com.nft.market.nft_market.entity;

import java.math.BigInteger;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Single mutable fee configuration record, owned by {@code AdminPolicy}.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "admin_config")
public class AdminConfig {

    public static final String SINGLETON_ID = "marketplace";

    @Id
    @Builder.Default
    private String id = SINGLETON_ID;

    private String admin;

    private int feePercentBasisPoints;

    private BigInteger minimumFee;

    public AdminConfig copy() {
        return toBuilder().build();
    }
}
