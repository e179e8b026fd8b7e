package com.nft.market.nft_market.engine;

import java.math.BigInteger;

/**
 * Order id carried through the ledger as an opaque payload: one 32-byte
 * big-endian word, the same layout the ledger uses for amounts.
 */
public final class OrderPayload {

    static final int WORD_SIZE = 32;

    private OrderPayload() {
    }

    public static byte[] encode(long orderId) {
        if (orderId <= 0) {
            throw new IllegalArgumentException("Order id must be positive: " + orderId);
        }
        byte[] raw = BigInteger.valueOf(orderId).toByteArray();
        byte[] word = new byte[WORD_SIZE];
        System.arraycopy(raw, 0, word, WORD_SIZE - raw.length, raw.length);
        return word;
    }

    /**
     * @throws IllegalArgumentException if the payload is not a single word
     *         holding a positive order id
     */
    public static long decode(byte[] payload) {
        if (payload == null || payload.length != WORD_SIZE) {
            throw new IllegalArgumentException("Payload must be " + WORD_SIZE + " bytes, got "
                    + (payload == null ? "null" : payload.length));
        }
        BigInteger value = new BigInteger(1, payload);
        if (value.signum() == 0 || value.bitLength() > 63) {
            throw new IllegalArgumentException("Payload does not hold an order id: " + value);
        }
        return value.longValueExact();
    }
}
