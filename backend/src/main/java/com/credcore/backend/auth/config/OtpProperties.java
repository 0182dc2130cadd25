package com.credcore.backend.auth.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * OTP(TOTP) 관련 정책 설정
 * - 보안 정책을 코드에 하드코딩하지 않고 설정으로 분리해서 운영/튜닝 가능하게 한다.
 *
 * # [Application Domain Config]
 *
 * app:
 *   otp:
 *     issuer: credcore
 *     digits: 6
 *     period-seconds: 30
 *     sms-cooldown-seconds: 60
 *     email-cooldown-seconds: 60
 *     sms-expiry-seconds: 300
 */
@Validated
@ConfigurationProperties(prefix = "app.otp")
public record OtpProperties(
        @NotBlank String issuer,              // otpauth:// 키 디스크립터의 issuer (브랜딩)
        @Min(6) @Max(8) int digits,           // 코드 자릿수
        @Min(1) int periodSeconds,            // TOTP 시간 창
        @Min(1) int smsCooldownSeconds,       // SMS 재발급 쿨다운
        @Min(1) int emailCooldownSeconds,     // 확인 메일 재발송 쿨다운
        @Min(1) int smsExpirySeconds          // 발급 후 SMS 코드 유효시간
) {
    public Duration period() {
        return Duration.ofSeconds(periodSeconds);
    }
}
