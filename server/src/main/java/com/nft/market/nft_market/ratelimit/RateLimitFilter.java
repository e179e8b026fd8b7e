package com.nft.market.nft_market.ratelimit;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Enforces per-client request limits.
 *
 * Identifier:
 * 1. Authenticated callers: by address (the token subject)
 * 2. Anonymous reads: by client IP
 *
 * A rejected request gets 429 with a Retry-After header and never reaches the
 * marketplace executor.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private final RateLimiter rateLimiter;
    private final List<String> exemptedPaths;

    public RateLimitFilter(RateLimiter rateLimiter, List<String> exemptedPaths) {
        this.rateLimiter = rateLimiter;
        this.exemptedPaths = exemptedPaths != null ? exemptedPaths : List.of();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        if (isExempted(request.getRequestURI())) {
            filterChain.doFilter(request, response);
            return;
        }

        String identifier = getIdentifier(request);
        if (!rateLimiter.tryAcquire(identifier)) {
            long retryAfter = rateLimiter.getRetryAfterSeconds(identifier);
            log.warn("Rate limit exceeded for {} on {}", identifier, request.getRequestURI());
            sendRateLimitExceededResponse(response, identifier, retryAfter);
            return;
        }

        response.setHeader("X-RateLimit-Identifier", identifier);
        filterChain.doFilter(request, response);
    }

    private String getIdentifier(HttpServletRequest request) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getPrincipal() instanceof String) {
            String caller = (String) auth.getPrincipal();
            if (!caller.equals("anonymousUser")) {
                return "caller:" + caller;
            }
        }
        return "ip:" + getClientIp(request);
    }

    private String getClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private boolean isExempted(String path) {
        return exemptedPaths.stream().anyMatch(path::startsWith);
    }

    private void sendRateLimitExceededResponse(
            HttpServletResponse response,
            String identifier,
            long retryAfter) throws IOException {

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(retryAfter));
        response.setHeader("X-RateLimit-Identifier", identifier);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(String.format(
                "{\"status\":429,\"error\":\"RATE_LIMITED\",\"message\":\"Rate limit exceeded\",\"retryAfter\":%d}",
                retryAfter));
        response.getWriter().flush();
    }
}
