package com.nft.market.nft_market.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class JwtUtilTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-42";
    private static final String CALLER = "0xAbCdEf0000000000000000000000000000000001";

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final JwtUtil jwtUtil = new JwtUtil(SECRET, Duration.ofHours(1), clock);

    @Test
    void tokenSubjectIsTheNormalizedCaller() {
        String token = jwtUtil.generateToken(CALLER);

        assertThat(jwtUtil.validateToken(token)).isEqualTo(CALLER.toLowerCase());
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtUtil other = new JwtUtil("another-secret-another-secret-another-1", Duration.ofHours(1), clock);

        assertThat(jwtUtil.validateToken(other.generateToken(CALLER))).isNull();
    }

    @Test
    void expiredTokenIsRejected() {
        String token = jwtUtil.generateToken(CALLER);
        JwtUtil later = new JwtUtil(SECRET, Duration.ofHours(1), Clock.offset(clock, Duration.ofHours(2)));

        assertThat(later.validateToken(token)).isNull();
    }

    @Test
    void garbageIsRejected() {
        assertThat(jwtUtil.validateToken("not.a.token")).isNull();
        assertThat(jwtUtil.validateToken("")).isNull();
    }
}
