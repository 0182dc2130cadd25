package com.credcore.backend.auth.domain;

import java.time.LocalDateTime;

/**
 * 확인 토큰 교체 기록 (before/after 한 쌍)
 *
 * - 발송 실패 시 User.restoreEmailConfirmation(swap)으로 이전 값을 그대로 되돌린다.
 * - DB 반영은 트랜잭션 롤백이 책임지고, 이 기록은 같은 트랜잭션 안의 엔티티 상태를 되돌리는 용도다.
 */
public record TokenSwap(
        String previousToken,
        LocalDateTime previousSentAt,
        String issuedToken
) {}
