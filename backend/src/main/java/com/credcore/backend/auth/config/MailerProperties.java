package com.credcore.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * 이메일 채널(확인 링크) 정책
 *
 * app:
 *   mailer:
 *     autoconfirm: false
 *     confirmation-ttl-minutes: 1440
 *     confirmation-url: http://localhost:8080/auth/verify
 *     confirmation-subject: "[CredCore] 가입 확인"
 *     from: no-reply@credcore.local
 */
@Validated
@ConfigurationProperties(prefix = "app.mailer")
public record MailerProperties(
        boolean autoconfirm,
        @Min(1) int confirmationTtlMinutes,
        @NotBlank String confirmationUrl,
        @NotBlank String confirmationSubject,
        @NotBlank @Email String from
) {
}
