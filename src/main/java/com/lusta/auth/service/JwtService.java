package com.lusta.auth.service;

import com.lusta.auth.config.AuthProperties;
import com.lusta.domain.dto.Identity;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

@Service
public class JwtService {

    public static final String CLAIM_USER_ID = "uid";
    public static final String CLAIM_USERNAME = "name";
    public static final String CLAIM_TOKEN_TYPE = "typ";

    public static final String TOKEN_TYPE_ACCESS = "access";

    private final AuthProperties props;
    private final SecretKey key;

    public JwtService(AuthProperties props) {
        this.props = props;
        this.key = Keys.hmacShaKeyFor(props.jwtSecret().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 签发 accessToken：uid + 显示名。
     *
     * <p>显示名注册后不可变，放进 token 后 WS 握手无需查库即可得到完整身份。</p>
     */
    public String issueAccessToken(Identity identity) {
        Instant now = Instant.now();
        Instant exp = now.plusSeconds(props.accessTokenTtlSeconds());

        return Jwts.builder()
                .issuer(props.issuer())
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(exp))
                .claims(Map.of(
                        CLAIM_USER_ID, identity.userId(),
                        CLAIM_USERNAME, identity.username(),
                        CLAIM_TOKEN_TYPE, TOKEN_TYPE_ACCESS
                ))
                .signWith(key)
                .compact();
    }

    /**
     * 解析并校验 accessToken：签名、issuer、过期时间、typ。
     */
    public Jws<Claims> parseAccessToken(String token) {
        JwtParser parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(props.issuer())
                .build();

        Jws<Claims> jws = parser.parseSignedClaims(token);
        String typ = jws.getPayload().get(CLAIM_TOKEN_TYPE, String.class);
        if (!TOKEN_TYPE_ACCESS.equals(typ)) {
            throw new JwtException("token_type_not_access");
        }
        return jws;
    }

    public Identity getIdentity(Claims claims) {
        Number uid = claims.get(CLAIM_USER_ID, Number.class);
        if (uid == null) {
            throw new JwtException("missing_uid");
        }
        String name = claims.get(CLAIM_USERNAME, String.class);
        if (name == null || name.isBlank()) {
            throw new JwtException("missing_name");
        }
        return new Identity(uid.longValue(), name);
    }
}
