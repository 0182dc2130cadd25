package com.credcore.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.credcore.backend.auth.config.AuthProperties;
import com.credcore.backend.auth.domain.User;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access Token(JWT, HS256) 발급
 *
 * 클레임:
 * - iss: app.auth.jwt.issuer
 * - sub: userId
 * - aud: 가입한 오디언스
 * - tenant_id, role, email/phone(등록된 채널만)
 * - iat / exp (exp = iat + app.auth.jwt.access-ttl-seconds)
 *
 * 검증은 토큰을 받는 리소스 서버 몫이다. 이 서비스는 발급만 한다.
 */
@Service
public class JwtService {

    private static final int MIN_SECRET_BYTES = 32;

    public static final String ROLE_CLAIM = "role";
    public static final String TENANT_CLAIM = "tenant_id";
    public static final String EMAIL_CLAIM = "email";
    public static final String PHONE_CLAIM = "phone";

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SecretKey key;

    public JwtService(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;
        this.key = buildHmacKey(jwtProps.secret());
    }

    public String issueAccessToken(User user) {
        if (user == null || user.getId() == null) {
            throw new IllegalArgumentException("user must be persisted before issuing a token");
        }

        Instant now = clock.instant();
        Instant exp = now.plusSeconds(jwtProps.accessTtlSeconds());

        var builder = Jwts.builder()
                .setIssuer(jwtProps.issuer())
                .setSubject(String.valueOf(user.getId()))
                .setAudience(user.getAudience())
                .claim(TENANT_CLAIM, user.getTenantId())
                .claim(ROLE_CLAIM, user.getRole().name())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp));

        if (user.hasEmail()) builder.claim(EMAIL_CLAIM, user.getEmail());
        if (user.hasPhone()) builder.claim(PHONE_CLAIM, user.getPhone());

        return builder.signWith(key, SignatureAlgorithm.HS256).compact();
    }

    private static SecretKey buildHmacKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be blank");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        return Keys.hmacShaKeyFor(bytes);
    }
}
