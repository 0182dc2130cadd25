package com.credcore.backend.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import com.credcore.backend.auth.config.AuthProperties;
import com.credcore.backend.auth.domain.AuthProvider;
import com.credcore.backend.auth.domain.User;
import com.credcore.backend.auth.domain.UserRole;
import com.credcore.backend.infra.TestClockConfig;
import com.credcore.backend.infra.TestClockConfig.MutableClock;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;

@DisplayName("[JwtService] access token 발급")
class JwtServiceTest {

    private static final String SECRET = "unit-test-jwt-secret-0123456789abcdef-0123";
    private static final String TENANT = "00000000-0000-0000-0000-000000000000";

    private final MutableClock clock = new MutableClock(TestClockConfig.TEST_START, TestClockConfig.TEST_ZONE);
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService(props("credcore", SECRET), clock);
    }

    @Test
    @DisplayName("sub/iss/aud/tenant/role 클레임이 사용자와 일치한다")
    void identity_claims_follow_user() {
        User user = persistedUser(7L, "anna@example.com", "821012345678");

        Claims claims = parse(jwtService.issueAccessToken(user));

        assertThat(claims.getSubject()).isEqualTo("7");
        assertThat(claims.getIssuer()).isEqualTo("credcore");
        assertThat(claims.getAudience()).isEqualTo("authenticated");
        assertThat(claims.get(JwtService.TENANT_CLAIM, String.class)).isEqualTo(TENANT);
        assertThat(claims.get(JwtService.ROLE_CLAIM, String.class)).isEqualTo(UserRole.USER.name());
        assertThat(claims.get(JwtService.EMAIL_CLAIM, String.class)).isEqualTo("anna@example.com");
    }

    @Test
    @DisplayName("등록된 채널만 email/phone 클레임으로 들어간다")
    void channel_claims_follow_registration() {
        User phoneOnly = persistedUser(8L, null, "821012345678");

        Claims claims = parse(jwtService.issueAccessToken(phoneOnly));

        assertThat(claims.get(JwtService.PHONE_CLAIM, String.class)).isEqualTo("821012345678");
        assertThat(claims.containsKey(JwtService.EMAIL_CLAIM)).isFalse();
        assertThat(claims.getExpiration().getTime() - claims.getIssuedAt().getTime()).isEqualTo(900_000L);
    }

    @Test
    @DisplayName("access-ttl이 지나면 토큰은 만료된다")
    void token_expires_after_ttl() {
        String token = jwtService.issueAccessToken(persistedUser(7L, "anna@example.com", null));

        clock.advanceSeconds(899);
        assertThat(parse(token).getSubject()).isEqualTo("7");

        clock.advanceSeconds(2);
        assertThatThrownBy(() -> parse(token)).isInstanceOf(ExpiredJwtException.class);
    }

    @Test
    @DisplayName("다른 issuer 설정이나 다른 키로 서명된 토큰은 이 서비스의 토큰으로 통과하지 않는다")
    void foreign_issuer_or_key_is_rejected() {
        User user = persistedUser(7L, "anna@example.com", null);
        String foreignIssuer = new JwtService(props("someone-else", SECRET), clock).issueAccessToken(user);
        String foreignKey = new JwtService(props("credcore", SECRET + "-rotated"), clock).issueAccessToken(user);

        assertThatThrownBy(() -> parse(foreignIssuer)).isInstanceOf(JwtException.class);
        assertThatThrownBy(() -> parse(foreignKey)).isInstanceOf(JwtException.class);
    }

    @Test
    @DisplayName("저장되지 않은 사용자(id 없음)에게는 발급하지 않는다")
    void unsaved_user_is_rejected() {
        User unsaved = User.createPending(TENANT, "authenticated", "a@b.io", null, "hash",
                AuthProvider.EMAIL, null, LocalDateTime.now(clock));

        assertThatThrownBy(() -> jwtService.issueAccessToken(unsaved))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("HS256 키가 32바이트 미만이면 생성 실패")
    void short_secret_fails_fast() {
        assertThatThrownBy(() -> new JwtService(props("credcore", "short"), clock))
                .isInstanceOf(IllegalStateException.class);
    }

    private Claims parse(String token) {
        return AccessTokenClaims.parse(token, props("credcore", SECRET), clock);
    }

    private static AuthProperties props(String issuer, String secret) {
        return new AuthProperties(
                new AuthProperties.Jwt(issuer, 900, secret),
                new AuthProperties.Refresh(3600));
    }

    private User persistedUser(Long id, String email, String phone) {
        User user = User.createPending(TENANT, "authenticated", email, phone, "hash",
                phone != null ? AuthProvider.PHONE : AuthProvider.EMAIL, null, LocalDateTime.now(clock));
        ReflectionTestUtils.setField(user, "id", id);
        return user;
    }
}
