package com.credcore.backend.auth.otp.service;

import java.time.Duration;
import java.time.LocalDateTime;

import org.springframework.stereotype.Component;

import com.credcore.backend.auth.config.OtpProperties;
import com.credcore.backend.auth.otp.domain.OtpChannel;
import com.credcore.backend.auth.otp.domain.OtpSecret;
import com.credcore.backend.global.ApiException;
import com.credcore.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 재발급 쿨다운 정책
 *
 * - throttled ⇔ lastIssuedAt != null && now < lastIssuedAt + cooldown
 * - lastIssuedAt == null이면 절대 막지 않는다(첫 발급).
 * - 쿨다운은 채널별 설정값 (app.otp.sms-cooldown-seconds / email-cooldown-seconds)
 *
 * 행 잠금(findForUpdate) 이후에 호출되어야 검사와 갱신 사이에 다른 요청이 끼어들지 못한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OtpRateLimiter {

    private final OtpProperties props;

    public void check(OtpSecret secret, LocalDateTime now) {
        long retryAfter = retryAfterSeconds(secret.getLastIssuedAt(), now, cooldownOf(secret.getChannel()));
        if (retryAfter > 0) {
            log.warn("OTP 쿨다운 차단: userId={}, channel={}, retryAfter={}s",
                    secret.getUserId(), secret.getChannel(), retryAfter);
            throw throttled(retryAfter);
        }
    }

    public Duration cooldownOf(OtpChannel channel) {
        return switch (channel) {
            case PHONE -> Duration.ofSeconds(props.smsCooldownSeconds());
            case EMAIL -> Duration.ofSeconds(props.emailCooldownSeconds());
        };
    }

    public ApiException throttled(long retryAfterSeconds) {
        return new ApiException(
                ErrorCode.OTP_COOLDOWN,
                ErrorCode.OTP_COOLDOWN.defaultMessage(),
                (int) Math.max(retryAfterSeconds, 1),
                null);
    }

    /**
     * 남은 쿨다운(초, 올림). 0이면 발급 가능.
     */
    public static long retryAfterSeconds(LocalDateTime lastIssuedAt, LocalDateTime now, Duration cooldown) {
        if (lastIssuedAt == null) return 0;

        LocalDateTime availableAt = lastIssuedAt.plus(cooldown);
        if (!now.isBefore(availableAt)) return 0;

        long millis = Duration.between(now, availableAt).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
