package com.credcore.backend.auth.hook;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

// 기본 훅 구독자: 운영 추적용 로그만 남긴다.
@Slf4j
@Component
public class AuthHookLoggingListener {

    @EventListener
    public void on(AuthHookEvent event) {
        log.info("auth hook: kind={}, tenant={}, userId={}", event.kind(), event.tenantId(), event.userId());
    }
}
