package com.nft.market.nft_market.ratelimit;

/**
 * Per-client request throttling.
 */
public interface RateLimiter {

    /**
     * Attempts to acquire a permit for the given identifier.
     *
     * @param identifier caller address or client IP
     * @return true if the request is allowed
     */
    boolean tryAcquire(String identifier);

    /**
     * Seconds until the identifier gets a new permit, 0 if one is available.
     */
    long getRetryAfterSeconds(String identifier);

    void reset(String identifier);

    /**
     * Drops state for identifiers that are idle.
     */
    void cleanup();
}
