package com.nft.market.nft_market.controller.dto;

import java.math.BigInteger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Body for the sandbox collaborator endpoints.
 *
 * account is the acting or receiving account, counterparty the spender or
 * operator being authorized. approved is the on/off switch of the toggle
 * endpoints and defaults to on.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class SandboxRequest {

    String account;

    String counterparty;

    BigInteger amount;

    BigInteger itemId;

    Boolean approved;
}
