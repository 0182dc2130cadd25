package com.credcore.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * 토큰 원문 생성기
 *
 * - SecureRandom: 예측 불가능한 난수 필요
 * - Base64 URL-safe: 링크/헤더에 안전한 문자셋 (-, _) 사용, padding 제거
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    private static final int REFRESH_TOKEN_BYTES = 48;
    private static final int CONFIRMATION_TOKEN_BYTES = 16;
    private static final int RANDOM_PASSWORD_BYTES = 48; // base64 64자

    private final SecureRandom secureRandom;

    /** Refresh Token raw 생성 */
    public String generateRefreshToken() {
        return urlSafe(REFRESH_TOKEN_BYTES);
    }

    /** 이메일 확인 링크 토큰 (16바이트 → 22자) */
    public String generateConfirmationToken() {
        return urlSafe(CONFIRMATION_TOKEN_BYTES);
    }

    /** 전화번호만으로 OTP 가입을 시작할 때 쓰는 임의 비밀번호 (64자) */
    public String generateRandomPassword() {
        return urlSafe(RANDOM_PASSWORD_BYTES);
    }

    private String urlSafe(int numBytes) {
        byte[] bytes = new byte[numBytes];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
