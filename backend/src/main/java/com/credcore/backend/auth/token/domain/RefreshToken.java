package com.credcore.backend.auth.token.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * refresh_tokens 테이블 매핑 엔티티
 *
 * - 가입/확인이 끝나 access grant를 내줄 때 access token과 함께 발급된다.
 * - refresh raw(원문)은 DB에 저장하지 않는다. token_hash(sha256 hex)만 저장.
 * - 로테이션/폐기는 이 서비스의 범위가 아니다. 발급만 한다.
 */
@Getter
@Entity
@Table(
    name = "refresh_tokens",
    indexes = {
        @Index(name = "idx_refresh_token_hash", columnList = "token_hash", unique = true),
        @Index(name = "idx_refresh_user_id", columnList = "user_id")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RefreshToken {

    public static final int TOKEN_HASH_LEN = 64; // sha256 hex

    private static final String HEX64_REGEX = "^[0-9a-f]{64}$";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "token_hash", nullable = false, length = TOKEN_HASH_LEN)
    private String tokenHash;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;


    public static RefreshToken issue(
            Long userId,
            String tokenHash,
            LocalDateTime now,
            LocalDateTime expiresAt
    ) {
        require(userId != null, "userId must not be null");
        require(now != null, "now must not be null");
        require(expiresAt != null, "expiresAt must not be null");
        require(expiresAt.isAfter(now), "expiresAt must be after now");
        require(tokenHash != null && tokenHash.matches(HEX64_REGEX), "tokenHash must be lowercase hex(64)");

        RefreshToken rt = new RefreshToken();
        rt.userId = userId;
        rt.tokenHash = tokenHash;
        rt.createdAt = now;
        rt.expiresAt = expiresAt;
        return rt;
    }

    public boolean isExpired(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
