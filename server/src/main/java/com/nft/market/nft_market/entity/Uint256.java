package com.nft.market.nft_market.entity;

import java.math.BigInteger;

/**
 * Checked arithmetic for unsigned 256-bit ledger amounts and item ids.
 *
 * Amounts are whole units of the fungible balance, never fractional.
 * Every operation that would leave the [0, 2^256 - 1] range throws
 * {@link ArithmeticException}, which the settlement engine classifies as an
 * arithmetic fault.
 */
public final class Uint256 {

    public static final BigInteger MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    public static final BigInteger ZERO = BigInteger.ZERO;

    private Uint256() {
    }

    /**
     * Parse a decimal string (safest for user input).
     */
    public static BigInteger of(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        try {
            return requireInRange(new BigInteger(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + value, e);
        }
    }

    public static BigInteger of(long value) {
        return requireInRange(BigInteger.valueOf(value));
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        return checked(a.add(b), "addition overflow");
    }

    public static BigInteger subtract(BigInteger a, BigInteger b) {
        return checked(a.subtract(b), "subtraction underflow");
    }

    public static BigInteger multiply(BigInteger a, BigInteger b) {
        return checked(a.multiply(b), "multiplication overflow");
    }

    public static BigInteger divide(BigInteger a, BigInteger b) {
        if (b.signum() == 0) {
            throw new ArithmeticException("uint256 division by zero");
        }
        return a.divide(b);
    }

    public static BigInteger max(BigInteger a, BigInteger b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static boolean isValid(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(MAX) <= 0;
    }

    /**
     * Reject values that do not fit an unsigned 256-bit word.
     */
    public static BigInteger requireInRange(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (!isValid(value)) {
            throw new IllegalArgumentException("Amount out of uint256 range: " + value);
        }
        return value;
    }

    private static BigInteger checked(BigInteger result, String what) {
        if (result.signum() < 0 || result.compareTo(MAX) > 0) {
            throw new ArithmeticException("uint256 " + what);
        }
        return result;
    }
}
