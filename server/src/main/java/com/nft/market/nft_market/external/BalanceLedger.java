package com.nft.market.nft_market.external;

import java.math.BigInteger;

/**
 * Fungible balance ledger, owned and operated outside the marketplace.
 */
public interface BalanceLedger {

    String address();

    BigInteger balanceOf(String account);

    BigInteger allowance(String owner, String spender);

    /**
     * Move {@code amount} from {@code from} to {@code to}, spending the allowance
     * {@code from} granted to {@code spender}.
     */
    boolean transferFrom(String spender, String from, String to, BigInteger amount);

    /**
     * Like {@link #transferFrom}, then invokes the recipient's
     * {@link TransferReceiver} with {@code (from, amount, payload)} before
     * returning.
     */
    boolean transferWithCallback(String spender, String from, String to, BigInteger amount, byte[] payload);
}
