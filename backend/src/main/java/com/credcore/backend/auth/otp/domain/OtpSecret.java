package com.credcore.backend.auth.otp.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import org.hibernate.annotations.DynamicUpdate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * otp_secrets 테이블 매핑 엔티티 (사용자 x 테넌트 x 채널당 1개)
 *
 * - payload: AES-GCM 암호문(nonce ‖ ciphertext ‖ tag). 평문 키 디스크립터는 DB/로그에 절대 남기지 않는다.
 * - keyVersion: payload를 만든 키 유도 방식 태그. 현재는 1(32바이트 패스프레이즈 직접 사용)만 존재.
 * - lastIssuedAt: 마지막 코드 발급 시각. null이면 한 번도 발급되지 않음(쿨다운 대상 아님).
 *   검증에 성공해도 지우지 않는다. 쿨다운은 계속 이 값 기준이다.
 * - consumedAt: 마지막 발급분이 검증에 쓰인 시각. 새로 발급하면 null로 돌아간다.
 *
 * 수명:
 * - 해당 채널 첫 발급 시 생성, 이후에는 lastIssuedAt만 바뀐다.
 * - @DynamicUpdate: 변경된 컬럼만 UPDATE (payload 등 다른 컬럼을 덮어쓰지 않음)
 * - @Version: 락 없이 들어온 갱신과 충돌하면 OptimisticLockException
 */
@Getter
@Entity
@DynamicUpdate
@Table(
    name = "otp_secrets",
    uniqueConstraints = @UniqueConstraint(
            name = "uq_otp_secrets_owner_channel",
            columnNames = {"user_id", "tenant_id", "channel"})
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OtpSecret {

    public static final int PAYLOAD_MAX = 512;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 36)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private OtpChannel channel;

    @Column(nullable = false, updatable = false, length = PAYLOAD_MAX)
    private byte[] payload;

    @Column(name = "key_version", nullable = false, updatable = false)
    private int keyVersion;

    @Column(name = "last_issued_at")
    private LocalDateTime lastIssuedAt;

    @Column(name = "consumed_at")
    private LocalDateTime consumedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(nullable = false)
    private long version;


    // ========= factory =========

    public static OtpSecret provision(
            Long userId,
            String tenantId,
            OtpChannel channel,
            byte[] payload,
            int keyVersion,
            LocalDateTime now
    ) {
        require(userId != null, "userId must not be null");
        require(tenantId != null && !tenantId.isBlank(), "tenantId must not be blank");
        require(channel != null, "channel must not be null");
        require(payload != null && payload.length > 0 && payload.length <= PAYLOAD_MAX, "payload size out of range");

        OtpSecret s = new OtpSecret();
        s.userId = userId;
        s.tenantId = tenantId;
        s.channel = channel;
        s.payload = payload;
        s.keyVersion = keyVersion;
        s.createdAt = now;
        s.updatedAt = now;
        return s;
    }


    // ========= issuance =========

    // 반환값: 발급 전 상태 (발송 실패 시 되돌리기용)
    public IssuanceMark recordIssuance(LocalDateTime at) {
        Objects.requireNonNull(at, "at must not be null");
        IssuanceMark previous = new IssuanceMark(this.lastIssuedAt, this.consumedAt);
        this.lastIssuedAt = at;
        this.consumedAt = null;
        this.updatedAt = at;
        return previous;
    }

    public void restoreIssuance(IssuanceMark previous) {
        this.lastIssuedAt = previous.issuedAt();
        this.consumedAt = previous.consumedAt();
    }

    // 같은 코드 재사용을 막는다. lastIssuedAt은 그대로라 쿨다운은 유지된다.
    public void consume(LocalDateTime now) {
        this.consumedAt = Objects.requireNonNull(now, "now must not be null");
        this.updatedAt = now;
    }

    public boolean hasPendingIssuance() {
        return lastIssuedAt != null && consumedAt == null;
    }

    public record IssuanceMark(LocalDateTime issuedAt, LocalDateTime consumedAt) {}


    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
