package com.credcore.backend.auth.identity.signup.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

import com.credcore.backend.auth.audit.AuditAction;
import com.credcore.backend.auth.audit.AuditLogService;
import com.credcore.backend.auth.config.MailerProperties;
import com.credcore.backend.auth.config.OtpProperties;
import com.credcore.backend.auth.config.SmsProperties;
import com.credcore.backend.auth.delivery.DeliveryException;
import com.credcore.backend.auth.delivery.DeliveryGateway;
import com.credcore.backend.auth.delivery.DeliveryMessage;
import com.credcore.backend.auth.domain.TokenSwap;
import com.credcore.backend.auth.domain.User;
import com.credcore.backend.auth.hook.EventHookDispatcher;
import com.credcore.backend.auth.hook.HookKind;
import com.credcore.backend.auth.identity.signup.dto.VerifyRequest;
import com.credcore.backend.auth.otp.crypto.SecretCipherException;
import com.credcore.backend.auth.otp.domain.OtpChannel;
import com.credcore.backend.auth.otp.domain.OtpSecret;
import com.credcore.backend.auth.otp.service.OtpRateLimiter;
import com.credcore.backend.auth.otp.service.OtpSecretStore;
import com.credcore.backend.auth.otp.service.SecretConflictException;
import com.credcore.backend.auth.otp.support.TotpCodeGenerator;
import com.credcore.backend.auth.otp.support.TotpKeyFactory;
import com.credcore.backend.auth.token.support.TokenGenerator;
import com.credcore.backend.global.ApiException;
import com.credcore.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 채널별 확인 발송 (이메일 확인 링크 / SMS 코드)
 *
 * 호출자 트랜잭션 안에서만 돈다(MANDATORY). 두 단계로 나뉜다.
 *
 * prepare (채널마다):
 * 1) 시크릿 row 잠금 조회 → 쿨다운 검사 → 없으면 생성
 * 2) (email) 새 확인 토큰을 사용자에 교체, (phone) 시크릿 복호화 후 TOTP 계산
 * 3) 발급 시각 기록(flush) + OTP_ISSUED 감사 로그
 *
 * deliver (모든 채널의 prepare가 끝난 뒤):
 * - 외부 발송. 하나라도 실패하면 준비한 채널 전부를 발급 전 값으로 되돌리고 DELIVERY_FAILED.
 *   트랜잭션은 롤백된다.
 *
 * 어느 채널이든 쿨다운/충돌로 막히면 아무것도 발송되지 않는다.
 * 자동 확인(app.mailer.autoconfirm / app.sms.autoconfirm)이면 시크릿/발송 없이 바로 확인 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class ChannelConfirmationDispatcher {

    private final OtpSecretStore secretStore;
    private final OtpRateLimiter rateLimiter;
    private final TotpKeyFactory keyFactory;
    private final TotpCodeGenerator codeGenerator;
    private final TokenGenerator tokenGenerator;
    private final DeliveryGateway deliveryGateway;
    private final AuditLogService auditLogService;
    private final EventHookDispatcher hooks;

    private final OtpProperties otpProps;
    private final MailerProperties mailerProps;
    private final SmsProperties smsProps;
    private final Clock clock;


    // ========= email =========

    // 비어 있으면 자동 확인으로 끝났다(발송할 것 없음).
    Optional<PreparedDelivery> prepareEmail(SignupContext ctx, User user, LocalDateTime now) {
        if (mailerProps.autoconfirm()) {
            user.confirmEmail(now);
            auditLogService.record(ctx.tenantId(), user, AuditAction.USER_SIGNED_UP, OtpChannel.EMAIL);
            hooks.fire(HookKind.SIGNUP, user, ctx.tenantId());
            log.info("이메일 자동 확인: userId={}, tenant={}", user.getId(), ctx.tenantId());
            return Optional.empty();
        }

        OtpSecret secret = lockOrProvision(ctx, user, OtpChannel.EMAIL, user.getEmail(), now);

        String token = tokenGenerator.generateConfirmationToken();
        TokenSwap swap = user.issueEmailConfirmationToken(token, now);
        OtpSecret.IssuanceMark previous = recordIssuance(user, secret, now);
        auditLogService.record(ctx.tenantId(), user, AuditAction.OTP_ISSUED, OtpChannel.EMAIL);

        return Optional.of(new PreparedDelivery(
                OtpChannel.EMAIL,
                user.getEmail(),
                DeliveryMessage.mail(mailerProps.confirmationSubject(), confirmationLink(token)),
                () -> {
                    user.restoreEmailConfirmation(swap);
                    secret.restoreIssuance(previous);
                }));
    }


    // ========= phone =========

    Optional<PreparedDelivery> preparePhone(SignupContext ctx, User user, LocalDateTime now) {
        if (smsProps.autoconfirm()) {
            user.confirmPhone(now);
            auditLogService.record(ctx.tenantId(), user, AuditAction.USER_SIGNED_UP, OtpChannel.PHONE);
            hooks.fire(HookKind.SIGNUP, user, ctx.tenantId());
            log.info("전화번호 자동 확인: userId={}, tenant={}", user.getId(), ctx.tenantId());
            return Optional.empty();
        }
        return Optional.of(preparePhoneCode(ctx, user, now));
    }

    // 자동 확인 여부와 무관하게 코드를 발급한다. 발송 여부는 호출자가 정한다.
    PreparedDelivery preparePhoneCode(SignupContext ctx, User user, LocalDateTime now) {
        OtpSecret secret = lockOrProvision(ctx, user, OtpChannel.PHONE, user.getPhone(), now);
        String code = codeAt(secret, now);

        LocalDateTime previousSentAt = user.markPhoneConfirmationSent(now);
        OtpSecret.IssuanceMark previous = recordIssuance(user, secret, now);
        auditLogService.record(ctx.tenantId(), user, AuditAction.OTP_ISSUED, OtpChannel.PHONE);

        return new PreparedDelivery(
                OtpChannel.PHONE,
                user.getPhone(),
                DeliveryMessage.sms(smsProps.render(code)),
                () -> {
                    user.restorePhoneConfirmationSentAt(previousSentAt);
                    secret.restoreIssuance(previous);
                });
    }


    // ========= deliver =========

    void deliver(SignupContext ctx, User user, List<PreparedDelivery> prepared) {
        for (PreparedDelivery d : prepared) {
            try {
                deliveryGateway.send(d.channel(), d.destination(), d.message());
            } catch (DeliveryException e) {
                for (int i = prepared.size() - 1; i >= 0; i--) {
                    prepared.get(i).rollback().run();
                }
                throw new ApiException(ErrorCode.DELIVERY_FAILED, e);
            }
            log.info("확인 발송: userId={}, channel={}, tenant={}", user.getId(), d.channel(), ctx.tenantId());
        }
    }

    /**
     * 저장된 시크릿으로 issuedAt 시점의 코드를 다시 계산한다(검증용).
     */
    public String codeAt(OtpSecret secret, LocalDateTime issuedAt) {
        try {
            byte[] key = keyFactory.secretOf(secretStore.decrypt(secret));
            return codeGenerator.currentCode(
                    key,
                    issuedAt.atZone(clock.getZone()).toInstant(),
                    otpProps.period(),
                    otpProps.digits());
        } catch (SecretCipherException e) {
            throw new ApiException(ErrorCode.SECRET_CRYPTO_FAILURE, e);
        }
    }


    // ========= helpers =========

    private OtpSecret lockOrProvision(SignupContext ctx, User user, OtpChannel channel, String account, LocalDateTime now) {
        try {
            OtpSecret secret = secretStore.findForUpdate(user.getId(), ctx.tenantId(), channel).orElse(null);
            if (secret != null) {
                rateLimiter.check(secret, now);
                return secret;
            }
            return secretStore.create(user.getId(), ctx.tenantId(), channel, keyFactory.generate(account), now);
        } catch (SecretConflictException e) {
            throw concurrentIssuance(user, channel, e);
        } catch (SecretCipherException e) {
            throw new ApiException(ErrorCode.SECRET_CRYPTO_FAILURE, e);
        }
    }

    private OtpSecret.IssuanceMark recordIssuance(User user, OtpSecret secret, LocalDateTime now) {
        try {
            return secretStore.recordIssuance(secret, now);
        } catch (SecretConflictException e) {
            throw concurrentIssuance(user, secret.getChannel(), e);
        }
    }

    // 같은 쿨다운 창 안에 다른 요청이 먼저 발급했다. 패자는 쿨다운 전체를 기다리게 한다.
    private ApiException concurrentIssuance(User user, OtpChannel channel, SecretConflictException e) {
        log.warn("동시 발급 충돌: userId={}, channel={}", user.getId(), channel);
        ApiException throttled = rateLimiter.throttled(rateLimiter.cooldownOf(channel).toSeconds());
        throttled.initCause(e);
        return throttled;
    }

    private String confirmationLink(String token) {
        return UriComponentsBuilder.fromHttpUrl(mailerProps.confirmationUrl())
                .queryParam("type", VerifyRequest.TYPE_SIGNUP)
                .queryParam("token", token)
                .build()
                .toUriString();
    }
}
