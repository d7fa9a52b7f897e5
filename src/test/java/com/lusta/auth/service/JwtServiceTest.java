package com.lusta.auth.service;

import com.lusta.auth.config.AuthProperties;
import com.lusta.domain.dto.Identity;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-0123456789";

    private final JwtService jwtService = new JwtService(new AuthProperties("lusta-test", SECRET, 600));

    @Test
    void issuedToken_carriesIdentity() {
        String token = jwtService.issueAccessToken(new Identity(42L, "alice"));

        Claims claims = jwtService.parseAccessToken(token).getPayload();
        assertThat(claims.get(JwtService.CLAIM_TOKEN_TYPE, String.class)).isEqualTo(JwtService.TOKEN_TYPE_ACCESS);
        assertThat(jwtService.getIdentity(claims)).isEqualTo(new Identity(42L, "alice"));
    }

    @Test
    void tokenFromOtherIssuer_isRejected() {
        JwtService other = new JwtService(new AuthProperties("someone-else", SECRET, 600));
        String token = other.issueAccessToken(new Identity(1L, "alice"));

        assertThatThrownBy(() -> jwtService.parseAccessToken(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void nonAccessToken_isRejected() {
        String token = Jwts.builder()
                .issuer("lusta-test")
                .claim(JwtService.CLAIM_USER_ID, 1L)
                .claim(JwtService.CLAIM_USERNAME, "alice")
                .claim(JwtService.CLAIM_TOKEN_TYPE, "refresh")
                .expiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertThatThrownBy(() -> jwtService.parseAccessToken(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void tokenSignedWithOtherKey_isRejected() {
        JwtService forged = new JwtService(new AuthProperties("lusta-test", "another-secret-another-secret-another-secret", 600));
        String token = forged.issueAccessToken(new Identity(7L, "bob"));

        assertThatThrownBy(() -> jwtService.parseAccessToken(token)).isInstanceOf(JwtException.class);
    }
}
