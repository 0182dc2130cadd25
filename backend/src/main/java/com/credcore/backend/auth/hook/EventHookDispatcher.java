package com.credcore.backend.auth.hook;

import java.time.Clock;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import com.credcore.backend.auth.domain.User;

import lombok.RequiredArgsConstructor;

/**
 * 가입/로그인 이벤트 훅 발행기
 *
 * - ApplicationEventPublisher로 동기 발행한다(@EventListener).
 *   리스너 예외는 호출한 트랜잭션을 롤백시킨다.
 * - VALIDATE는 insert 전이라 userId가 null이다.
 */
@Component
@RequiredArgsConstructor
public class EventHookDispatcher {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void fire(HookKind kind, User user, String tenantId) {
        eventPublisher.publishEvent(new AuthHookEvent(
                kind,
                tenantId,
                user.getId(),
                user.getEmail(),
                user.getPhone(),
                clock.instant()));
    }
}
