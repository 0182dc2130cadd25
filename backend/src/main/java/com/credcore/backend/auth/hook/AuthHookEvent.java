package com.credcore.backend.auth.hook;

import java.time.Instant;

/**
 * 동기 훅 이벤트. 리스너는 발행한 트랜잭션 안에서 실행되고, 예외를 던지면 그 트랜잭션이 롤백된다.
 */
public record AuthHookEvent(
        HookKind kind,
        String tenantId,
        Long userId,
        String email,
        String phone,
        Instant occurredAt
) {}
