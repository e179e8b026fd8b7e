package com.nft.market.nft_market.ratelimit;

import java.time.Duration;

import org.springframework.scheduling.annotation.Scheduled;

import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;

/**
 * One resilience4j limiter per identifier, all sharing the same config.
 */
public class CallerRateLimiter implements RateLimiter {

    private final RateLimiterConfig config;
    private final RateLimiterRegistry registry;

    public CallerRateLimiter(int requestsPerSecond, Duration timeout) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be positive");
        }
        this.config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(requestsPerSecond)
                .timeoutDuration(timeout != null ? timeout : Duration.ZERO)
                .build();
        this.registry = RateLimiterRegistry.of(config);
    }

    @Override
    public boolean tryAcquire(String identifier) {
        return limiter(identifier).acquirePermission();
    }

    @Override
    public long getRetryAfterSeconds(String identifier) {
        return registry.find(identifier)
                .filter(limiter -> limiter.getMetrics().getAvailablePermissions() < 1)
                // permits come back with the next refresh period
                .map(limiter -> Math.max(1L, config.getLimitRefreshPeriod().toSeconds()))
                .orElse(0L);
    }

    @Override
    public void reset(String identifier) {
        registry.remove(identifier);
    }

    @Override
    @Scheduled(fixedRate = 300000) // 5 minutes
    public void cleanup() {
        registry.getAllRateLimiters().stream()
                .filter(limiter -> limiter.getMetrics().getAvailablePermissions() >= config.getLimitForPeriod())
                .map(io.github.resilience4j.ratelimiter.RateLimiter::getName)
                .toList()
                .forEach(registry::remove);
    }

    private io.github.resilience4j.ratelimiter.RateLimiter limiter(String identifier) {
        return registry.rateLimiter(identifier);
    }
}
