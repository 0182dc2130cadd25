package com.credcore.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/*
  @ConfigurationProperties(prefix = "app.auth"):
  가입/확인이 끝난 사용자에게 내려줄 access grant(JWT + refresh) 설정

  app:
    auth:
      jwt:
        issuer: credcore
        access-ttl-seconds: 3600
        secret: ${APP_AUTH_JWT_SECRET:?set APP_AUTH_JWT_SECRET}
      refresh:
        ttl-seconds: 1209600
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt,
                             @Valid @NotNull Refresh refresh) {

    /**
     * Access Token(JWT) 관련 설정
     * - issuer: 토큰 발급자 식별자
     * - accessTtlSeconds: Access Token 수명
     * - secret: HS256 서명을 위한 비밀키 문자열
     */
    public record Jwt(
        @NotBlank String issuer,
        @Min(1) long accessTtlSeconds,
        @NotBlank @Size(min = 32) String secret
    ) {}

    // Refresh Token 서버 측 수명
    public record Refresh(@Min(1) long ttlSeconds) {}
}
