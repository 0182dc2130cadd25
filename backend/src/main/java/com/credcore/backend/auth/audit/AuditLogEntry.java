package com.credcore.backend.auth.audit;

import java.time.LocalDateTime;

import com.credcore.backend.auth.otp.domain.OtpChannel;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * audit_log_entries 테이블 (append-only)
 * - actorEmail/actorPhone은 기록 시점 스냅샷이다.
 */
@Getter
@Entity
@Table(name = "audit_log_entries", indexes = {
        @Index(name = "idx_audit_tenant_user", columnList = "tenant_id, user_id")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 36)
    private String tenantId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private OtpChannel channel;

    @Column(name = "actor_email", length = 255)
    private String actorEmail;

    @Column(name = "actor_phone", length = 20)
    private String actorPhone;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static AuditLogEntry of(
            String tenantId,
            Long userId,
            AuditAction action,
            OtpChannel channel,
            String actorEmail,
            String actorPhone,
            LocalDateTime now
    ) {
        AuditLogEntry e = new AuditLogEntry();
        e.tenantId = tenantId;
        e.userId = userId;
        e.action = action;
        e.channel = channel;
        e.actorEmail = actorEmail;
        e.actorPhone = actorPhone;
        e.createdAt = now;
        return e;
    }
}
