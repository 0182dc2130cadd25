package com.credcore.backend.auth.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * users 테이블 = "가입 진행 중/완료 회원"
 *
 * 가입 흐름:
 * - SignupRegistrar가 (tenant, audience) 범위에서 email/phone으로 조회 후 없으면 생성한다.
 * - 채널(email/phone)마다 확인 상태를 따로 가진다.
 *   email: emailConfirmationToken / emailConfirmationSentAt / emailConfirmedAt
 *   phone: phoneConfirmationSentAt / phoneConfirmedAt (코드는 otp_secrets에서 재계산)
 *
 * 불변 조건:
 * - 등록한 모든 채널이 확인되어야 fully onboarded(ACTIVE)다.
 * - 이미 값이 있는 채널은 다른 값으로 덮어쓰지 않는다(attach는 null일 때만).
 */
@Getter
@Entity
@Table(name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_users_tenant_audience_email", columnNames = {"tenant_id", "audience", "email"}),
                @UniqueConstraint(name = "uq_users_tenant_audience_phone", columnNames = {"tenant_id", "audience", "phone"})
        },
        indexes = {
                @Index(name = "idx_users_confirmation_token", columnList = "email_confirmation_token")
        })
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    public static final int META_DATA_MAX = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id; // PK. JWT의 sub(subject)로 쓰임(userId)

    @Column(name = "tenant_id", nullable = false, length = 36)
    private String tenantId;

    @Column(nullable = false, length = 100)
    private String audience;

    @Column(length = 255)
    private String email; // 정규화(trim + 소문자)된 값

    @Column(length = 20)
    private String phone; // E.164, '+' 없이 숫자만

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash; // BCrypt 해시 (원문 저장 금지)

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuthProvider provider;

    @Column(name = "user_meta_data", length = META_DATA_MAX)
    private String userMetaData; // JSON 문자열

    @Column(name = "email_confirmation_token", length = 64)
    private String emailConfirmationToken;

    @Column(name = "email_confirmation_sent_at")
    private LocalDateTime emailConfirmationSentAt;

    @Column(name = "email_confirmed_at")
    private LocalDateTime emailConfirmedAt;

    @Column(name = "phone_confirmation_sent_at")
    private LocalDateTime phoneConfirmationSentAt;

    @Column(name = "phone_confirmed_at")
    private LocalDateTime phoneConfirmedAt;

    @Column(name = "last_sign_in_at")
    private LocalDateTime lastSignInAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;


    // ========= factory =========

    // 신규 가입 (모든 채널 미확인 상태로 시작)
    public static User createPending(
            String tenantId,
            String audience,
            String email,
            String phone,
            String passwordHash,
            AuthProvider provider,
            String userMetaData,
            LocalDateTime now
    ) {
        require(tenantId != null && audience != null, "tenantId/audience must not be null");
        require(email != null || phone != null, "email or phone is required");
        require(passwordHash != null, "passwordHash must not be null");

        User u = new User();
        u.tenantId = tenantId;
        u.audience = audience;
        u.email = email;
        u.phone = phone;
        u.passwordHash = passwordHash;
        u.provider = Objects.requireNonNull(provider, "provider must not be null");
        u.userMetaData = userMetaData;

        // 기본 정책값
        u.role = UserRole.USER;
        u.status = UserStatus.PENDING;
        u.createdAt = now;
        u.updatedAt = now;
        return u;
    }


    // ========= resume (재가입 요청) =========

    public void attachEmail(String email, LocalDateTime now) {
        require(this.email == null, "email already set");
        this.email = email;
        touch(now);
        refreshStatus();
    }

    public void attachPhone(String phone, LocalDateTime now) {
        require(this.phone == null, "phone already set");
        this.phone = phone;
        touch(now);
        refreshStatus();
    }

    public void replaceMetaData(String json, LocalDateTime now) {
        this.userMetaData = json;
        touch(now);
    }


    // ========= email channel =========

    public TokenSwap issueEmailConfirmationToken(String token, LocalDateTime now) {
        require(token != null && !token.isBlank(), "token must not be blank");
        TokenSwap swap = new TokenSwap(this.emailConfirmationToken, this.emailConfirmationSentAt, token);
        this.emailConfirmationToken = token;
        this.emailConfirmationSentAt = now;
        touch(now);
        return swap;
    }

    public void restoreEmailConfirmation(TokenSwap swap) {
        Objects.requireNonNull(swap, "swap must not be null");
        this.emailConfirmationToken = swap.previousToken();
        this.emailConfirmationSentAt = swap.previousSentAt();
    }

    public void confirmEmail(LocalDateTime now) {
        this.emailConfirmedAt = now;
        this.emailConfirmationToken = null;
        touch(now);
        refreshStatus();
    }


    // ========= phone channel =========

    // 반환값: 이전 발송 시각 (발송 실패 시 restorePhoneConfirmationSentAt에 넘긴다)
    public LocalDateTime markPhoneConfirmationSent(LocalDateTime now) {
        LocalDateTime previous = this.phoneConfirmationSentAt;
        this.phoneConfirmationSentAt = now;
        touch(now);
        return previous;
    }

    public void restorePhoneConfirmationSentAt(LocalDateTime previous) {
        this.phoneConfirmationSentAt = previous;
    }

    public void confirmPhone(LocalDateTime now) {
        this.phoneConfirmedAt = now;
        touch(now);
        refreshStatus();
    }


    // ========= sign-in =========

    public void markSignedIn(LocalDateTime now) {
        this.lastSignInAt = now;
        touch(now);
    }


    // ========= domain =========

    public boolean hasEmail() {
        return email != null;
    }

    public boolean hasPhone() {
        return phone != null;
    }

    public boolean isEmailConfirmed() {
        return emailConfirmedAt != null;
    }

    public boolean isPhoneConfirmed() {
        return phoneConfirmedAt != null;
    }

    // 등록한 모든 채널이 확인되었는가
    public boolean isFullyOnboarded() {
        return (!hasEmail() || isEmailConfirmed())
                && (!hasPhone() || isPhoneConfirmed());
    }


    // ========= helpers =========

    private void refreshStatus() {
        this.status = isFullyOnboarded() ? UserStatus.ACTIVE : UserStatus.PENDING;
    }

    private void touch(LocalDateTime now) {
        this.updatedAt = Objects.requireNonNull(now, "now must not be null");
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
