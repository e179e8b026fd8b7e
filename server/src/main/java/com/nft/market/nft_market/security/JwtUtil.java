package com.nft.market.nft_market.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import com.nft.market.nft_market.entity.Addresses;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues and validates HMAC-signed tokens whose subject is the caller's
 * address.
 */
@Slf4j
public class JwtUtil {

    private final SecretKey key;
    private final Duration tokenTtl;
    private final Clock clock;

    public JwtUtil(String secret, Duration tokenTtl, Clock clock) {
        // HS256 needs at least 32 bytes of key material
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenTtl = tokenTtl;
        this.clock = clock;
    }

    public String generateToken(String address) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(Addresses.normalize(address))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(tokenTtl)))
                .signWith(key)
                .compact();
    }

    /**
     * @return the normalized caller address, or null if the token is invalid,
     *         expired or does not name an address
     */
    public String validateToken(String token) {
        try {
            String subject = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload()
                    .getSubject();
            if (!Addresses.isValid(subject)) {
                log.debug("Rejected token with non-address subject {}", subject);
                return null;
            }
            return Addresses.normalize(subject);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            return null;
        }
    }
}
