package com.credcore.backend.auth.audit;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.credcore.backend.auth.domain.User;
import com.credcore.backend.auth.otp.domain.OtpChannel;

import lombok.RequiredArgsConstructor;

/**
 * 감사 로그 기록
 *
 * - 자신이 설명하는 상태 변경과 "같은 트랜잭션" 안에서만 호출된다(MANDATORY).
 * - 기록 실패는 곧 상태 변경 실패다. 트랜잭션 전체가 롤백된다.
 */
@Service
@RequiredArgsConstructor
public class AuditLogService {

    private final AuditLogEntryRepository repository;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(String tenantId, User user, AuditAction action) {
        record(tenantId, user, action, null);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(String tenantId, User user, AuditAction action, OtpChannel channel) {
        repository.save(AuditLogEntry.of(
                tenantId,
                user.getId(),
                action,
                channel,
                user.getEmail(),
                user.getPhone(),
                LocalDateTime.now(clock)));
    }
}
