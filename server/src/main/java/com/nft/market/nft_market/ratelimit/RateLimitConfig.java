package com.nft.market.nft_market.ratelimit;

import java.util.List;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.nft.market.nft_market.config.MarketplaceProperties;

/**
 * API rate limiting. The limit per second comes from
 * marketplace.rate-limit.requests-per-second.
 */
@Configuration
public class RateLimitConfig {

    // Paths exempted from rate limiting
    private static final List<String> EXEMPTED_PATHS = List.of("/actuator/");

    @Bean
    public RateLimiter rateLimiter(MarketplaceProperties properties) {
        MarketplaceProperties.RateLimit rateLimit = properties.rateLimit();
        return new CallerRateLimiter(rateLimit.requestsPerSecond(), rateLimit.timeout());
    }

    @Bean
    public RateLimitFilter rateLimitFilter(RateLimiter rateLimiter) {
        return new RateLimitFilter(rateLimiter, EXEMPTED_PATHS);
    }

    /**
     * The filter runs inside the security chain, after authentication, so it
     * must not also be registered as a plain servlet filter.
     */
    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitFilter rateLimitFilter) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(rateLimitFilter);
        registration.setEnabled(false);
        return registration;
    }
}
