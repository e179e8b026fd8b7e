package com.nft.market.nft_market.entity;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Account addresses are 20-byte hex strings ("0x" + 40 hex digits), kept in
 * lower case so they can be compared with {@link String#equals}.
 */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0x[a-f0-9]{40}$");

    private Addresses() {
    }

    public static boolean isValid(String address) {
        return address != null && ADDRESS.matcher(address.trim().toLowerCase(Locale.ROOT)).matches();
    }

    /**
     * Normalize to the canonical lower-case form.
     *
     * @throws IllegalArgumentException if the value is not a well-formed address
     */
    public static String normalize(String address) {
        if (!isValid(address)) {
            throw new IllegalArgumentException("Invalid address: " + address);
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isZero(String address) {
        return address == null || ZERO.equals(address);
    }

    public static boolean same(String a, String b) {
        return a != null && b != null && a.equalsIgnoreCase(b);
    }
}
