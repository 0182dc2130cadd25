package com.credcore.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * 회원가입 정책 설정
 *
 * app:
 *   signup:
 *     disabled: false
 *     password-min-length: 8
 *     default-tenant-id: 00000000-0000-0000-0000-000000000000
 *     default-audience: authenticated
 *
 * - 테넌트/오디언스 헤더(X-Tenant-Id, X-Audience)가 없으면 기본값을 쓴다.
 */
@Validated
@ConfigurationProperties(prefix = "app.signup")
public record SignupProperties(
        boolean disabled,
        @Min(1) int passwordMinLength,
        @NotBlank String defaultTenantId,
        @NotBlank String defaultAudience
) {
}
