package com.credcore.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * 전화번호 채널(SMS 코드) 정책
 *
 * app:
 *   sms:
 *     autoconfirm: false
 *     template: "[CredCore] 인증번호는 {code} 입니다."
 */
@Validated
@ConfigurationProperties(prefix = "app.sms")
public record SmsProperties(
        boolean autoconfirm,
        @NotBlank @Pattern(regexp = ".*\\{code}.*", message = "template must contain {code}")
        String template
) {
    public String render(String code) {
        return template.replace("{code}", code);
    }
}
