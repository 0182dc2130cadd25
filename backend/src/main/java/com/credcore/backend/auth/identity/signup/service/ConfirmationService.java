package com.credcore.backend.auth.identity.signup.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.credcore.backend.auth.audit.AuditAction;
import com.credcore.backend.auth.audit.AuditLogService;
import com.credcore.backend.auth.config.MailerProperties;
import com.credcore.backend.auth.config.OtpProperties;
import com.credcore.backend.auth.domain.User;
import com.credcore.backend.auth.hook.EventHookDispatcher;
import com.credcore.backend.auth.hook.HookKind;
import com.credcore.backend.auth.otp.domain.OtpChannel;
import com.credcore.backend.auth.otp.domain.OtpSecret;
import com.credcore.backend.auth.otp.service.OtpSecretStore;
import com.credcore.backend.auth.otp.service.SecretConflictException;
import com.credcore.backend.auth.otp.support.PhoneNumbers;
import com.credcore.backend.auth.repo.UserRepository;
import com.credcore.backend.global.ApiException;
import com.credcore.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 채널 확인 트랜잭션
 *
 * confirmEmail: 확인 링크 토큰으로 사용자 조회 → 만료(sentAt + confirmation-ttl) 검사 → 확인 + 토큰 제거
 * verifyPhone: 시크릿 잠금 조회 → 만료(lastIssuedAt + sms-expiry) 검사 → 발급 시각 기준 코드 재계산 후 상수 시간 비교
 *   - 성공하면 시크릿의 발급 기록을 소비한다(같은 코드 재사용 불가).
 *   - 이미 확인된 전화번호도 코드가 맞으면 성공(로그인 용도로 재발급 받은 경우).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfirmationService {

    private final UserRepository userRepository;
    private final OtpSecretStore secretStore;
    private final ChannelConfirmationDispatcher dispatcher;
    private final AuditLogService auditLogService;
    private final EventHookDispatcher hooks;

    private final MailerProperties mailerProps;
    private final OtpProperties otpProps;
    private final Clock clock;

    @Transactional
    public User confirmEmail(SignupContext ctx, String token) {
        if (token == null || token.isBlank()) {
            throw new ApiException(ErrorCode.OTP_INVALID);
        }

        User user = userRepository
                .findByTenantIdAndAudienceAndEmailConfirmationToken(ctx.tenantId(), ctx.audience(), token)
                .orElseThrow(() -> new ApiException(ErrorCode.OTP_INVALID));

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime sentAt = user.getEmailConfirmationSentAt();
        if (sentAt == null || !now.isBefore(sentAt.plusMinutes(mailerProps.confirmationTtlMinutes()))) {
            throw new ApiException(ErrorCode.OTP_EXPIRED);
        }

        user.confirmEmail(now);
        auditLogService.record(ctx.tenantId(), user, AuditAction.USER_CONFIRMED, OtpChannel.EMAIL);
        hooks.fire(HookKind.SIGNUP, user, ctx.tenantId());

        log.info("이메일 확인 완료: userId={}, tenant={}", user.getId(), ctx.tenantId());
        return user;
    }

    @Transactional
    public User verifyPhone(SignupContext ctx, String rawPhone, String code) {
        String phone = PhoneNumbers.normalize(rawPhone);
        if (!PhoneNumbers.isValidE164(phone)) {
            throw new ApiException(ErrorCode.INVALID_PHONE_FORMAT);
        }
        if (code == null || code.isBlank()) {
            throw new ApiException(ErrorCode.OTP_INVALID);
        }

        User user = userRepository.findByTenantIdAndAudienceAndPhone(ctx.tenantId(), ctx.audience(), phone)
                .orElseThrow(() -> new ApiException(ErrorCode.OTP_NOT_FOUND));

        OtpSecret secret = lockSecret(ctx, user)
                .filter(OtpSecret::hasPendingIssuance)
                .orElseThrow(() -> new ApiException(ErrorCode.OTP_NOT_FOUND));

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime issuedAt = secret.getLastIssuedAt();
        if (!now.isBefore(issuedAt.plusSeconds(otpProps.smsExpirySeconds()))) {
            throw new ApiException(ErrorCode.OTP_EXPIRED);
        }

        String expected = dispatcher.codeAt(secret, issuedAt);
        if (!MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                code.trim().getBytes(StandardCharsets.UTF_8))) {
            log.warn("SMS 코드 불일치: userId={}, tenant={}", user.getId(), ctx.tenantId());
            throw new ApiException(ErrorCode.OTP_INVALID);
        }

        secretStore.consume(secret, now);

        if (!user.isPhoneConfirmed()) {
            user.confirmPhone(now);
            auditLogService.record(ctx.tenantId(), user, AuditAction.USER_CONFIRMED, OtpChannel.PHONE);
            hooks.fire(HookKind.SIGNUP, user, ctx.tenantId());
            log.info("전화번호 확인 완료: userId={}, tenant={}", user.getId(), ctx.tenantId());
        }
        return user;
    }

    private Optional<OtpSecret> lockSecret(SignupContext ctx, User user) {
        try {
            return secretStore.findForUpdate(user.getId(), ctx.tenantId(), OtpChannel.PHONE);
        } catch (SecretConflictException e) {
            throw new ApiException(ErrorCode.PERSISTENCE_ERROR, e);
        }
    }
}
