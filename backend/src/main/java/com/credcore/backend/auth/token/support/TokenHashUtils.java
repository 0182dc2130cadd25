package com.credcore.backend.auth.token.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * refresh token 원문은 DB에 저장하지 않는다.
 * - 저장/조회 모두 sha256Hex(raw) = token_hash 컬럼 값으로 한다.
 */
public final class TokenHashUtils {
    private TokenHashUtils() {}

    // 64자 소문자 hex
    public static String sha256Hex(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("raw token must not be null/blank");
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(raw.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
