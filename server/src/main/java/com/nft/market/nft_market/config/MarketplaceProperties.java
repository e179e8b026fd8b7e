package com.nft.market.nft_market.config;

import java.math.BigInteger;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Marketplace settings.
 *
 * Addresses are 20-byte hex strings. The fee settings only seed the admin
 * config on first start; afterwards the persisted config wins.
 */
@ConfigurationProperties(prefix = "marketplace")
public record MarketplaceProperties(

    /**
     * The marketplace's own account: the spender of ledger allowances and the
     * operator of item transfers.
     */
    String address,

    /**
     * The only caller accepted by the settlement callback.
     */
    String ledgerAddress,

    String adminAddress,

    int feePercentBps,

    BigInteger minimumFee,

    Persistence persistence,

    Sandbox sandbox,

    Security security,

    RateLimit rateLimit

) {

    public record Persistence(boolean enabled, long flushIntervalMs) {
    }

    /**
     * In-process ledger and item registry exposed over HTTP.
     */
    public record Sandbox(boolean enabled, String itemRegistryAddress) {
    }

    public record Security(String jwtSecret, Duration tokenTtl) {
    }

    public record RateLimit(int requestsPerSecond, Duration timeout) {
    }
}
