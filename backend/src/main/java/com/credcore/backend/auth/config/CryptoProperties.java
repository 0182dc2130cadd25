package com.credcore.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * OTP 시크릿 암호화용 패스프레이즈
 *
 * app:
 *   crypto:
 *     passphrase: ${APP_CRYPTO_PASSPHRASE:?set APP_CRYPTO_PASSPHRASE (32 bytes)}
 *
 * 길이(정확히 32바이트) 검증은 SecretCipher 생성 시점에 한다.
 * 한 번 데이터가 저장된 뒤에는 절대 바꾸면 안 된다(기존 시크릿 전부 복호화 불가).
 */
@Validated
@ConfigurationProperties(prefix = "app.crypto")
public record CryptoProperties(@NotBlank String passphrase) {

    // 로그/액추에이터에 원문이 찍히지 않게 한다.
    @Override
    public String toString() {
        return "CryptoProperties[passphrase=<hidden>]";
    }
}
