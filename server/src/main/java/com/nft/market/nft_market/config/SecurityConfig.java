package com.nft.market.nft_market.config;

import java.time.Clock;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.nft.market.nft_market.ratelimit.RateLimitFilter;
import com.nft.market.nft_market.security.JwtAuthenticationFilter;
import com.nft.market.nft_market.security.JwtUtil;

/**
 * Reads are public; every state-changing request needs a bearer token whose
 * subject is the caller's address. Rate limiting runs after authentication
 * so authenticated callers are limited by address.
 *
 * The sandbox endpoints hand out tokens for any address, so they are only
 * reachable when the sandbox is enabled (the {@code dev} profile).
 */
@Configuration
public class SecurityConfig {

    @Bean
    public JwtUtil jwtUtil(MarketplaceProperties properties, Clock clock) {
        MarketplaceProperties.Security security = properties.security();
        return new JwtUtil(security.jwtSecret(), security.tokenTtl(), clock);
    }

    @Bean
    public JwtAuthenticationFilter jwtAuthenticationFilter(JwtUtil jwtUtil) {
        return new JwtAuthenticationFilter(jwtUtil);
    }

    @Bean
    public FilterRegistrationBean<JwtAuthenticationFilter> jwtFilterRegistration(JwtAuthenticationFilter filter) {
        FilterRegistrationBean<JwtAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http,
            JwtAuthenticationFilter jwtFilter,
            RateLimitFilter rateLimitFilter,
            MarketplaceProperties properties) throws Exception {
        boolean sandboxOpen = properties.sandbox() != null && properties.sandbox().enabled();
        http.csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
                .authorizeHttpRequests(auth -> {
                    auth.requestMatchers(HttpMethod.GET, "/listings/**", "/orders/**", "/fees", "/events").permitAll();
                    if (sandboxOpen) {
                        auth.requestMatchers("/sandbox/**").permitAll();
                    } else {
                        auth.requestMatchers("/sandbox/**").denyAll();
                    }
                    auth.anyRequest().authenticated();
                })
                .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterAfter(rateLimitFilter, JwtAuthenticationFilter.class);

        return http.build();
    }
}
