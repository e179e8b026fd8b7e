package com.nft.market.nft_market.engine;

import java.math.BigInteger;

import com.nft.market.nft_market.entity.AdminConfig;
import com.nft.market.nft_market.entity.Uint256;
import com.nft.market.nft_market.exception.ErrorCode;
import com.nft.market.nft_market.exception.MarketplaceException;

import lombok.Value;

/**
 * Platform fee calculation.
 *
 * platformFee = max(price * feePercentBasisPoints / 10000, minimumFee)
 * sellerAmount = price - platformFee
 *
 * Integer division truncates, as the ledger works in whole units.
 */
public class FeeSchedule {

    public static final int BASIS_POINTS = 10_000;

    private static final BigInteger BASIS_POINTS_DIVISOR = BigInteger.valueOf(BASIS_POINTS);

    @Value
    public static class Quote {
        BigInteger price;
        BigInteger platformFee;
        BigInteger sellerAmount;
    }

    public BigInteger platformFee(BigInteger price, int feePercentBasisPoints, BigInteger minimumFee) {
        try {
            BigInteger proportional = Uint256.divide(
                    Uint256.multiply(price, BigInteger.valueOf(feePercentBasisPoints)),
                    BASIS_POINTS_DIVISOR);
            return Uint256.max(proportional, minimumFee);
        } catch (ArithmeticException e) {
            throw MarketplaceException.of(ErrorCode.ARITHMETIC_OVERFLOW,
                    "Platform fee for price " + price + " overflows: " + e.getMessage());
        }
    }

    /**
     * Fee and seller share for a price under the given configuration.
     *
     * @throws MarketplaceException INVALID_PRICE if the fee would exceed the price
     */
    public Quote quote(BigInteger price, AdminConfig config) {
        BigInteger fee = platformFee(price, config.getFeePercentBasisPoints(), config.getMinimumFee());
        if (fee.compareTo(price) > 0) {
            throw MarketplaceException.of(ErrorCode.INVALID_PRICE,
                    String.format("Price %s is below the platform fee %s", price, fee));
        }
        return new Quote(price, fee, Uint256.subtract(price, fee));
    }
}
