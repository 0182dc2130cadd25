package com.credcore.backend.auth.identity.signup.service;

/**
 * 요청 범위: 테넌트 + 오디언스
 * 사용자 조회/시크릿/감사 로그가 모두 이 범위 안에서만 일어난다.
 */
public record SignupContext(String tenantId, String audience) {

    public SignupContext {
        if (tenantId == null || tenantId.isBlank()) throw new IllegalArgumentException("tenantId must not be blank");
        if (audience == null || audience.isBlank()) throw new IllegalArgumentException("audience must not be blank");
    }
}
