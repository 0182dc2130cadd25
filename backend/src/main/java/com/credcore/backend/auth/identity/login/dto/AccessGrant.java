package com.credcore.backend.auth.identity.login.dto;

/**
 * 가입/확인이 끝난 사용자에게 내려주는 access grant
 * - accessToken: JWT (Authorization: Bearer)
 * - refreshToken: raw 원문. 서버에는 해시만 남는다.
 */
public record AccessGrant(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken
) {
    public static final String BEARER = "bearer";
}
