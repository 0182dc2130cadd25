package com.credcore.backend.auth.otp.support;

import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

import com.eatthepath.otp.TimeBasedOneTimePasswordGenerator;

/**
 * RFC 6238 TOTP 코드 계산기 (HMAC-SHA256)
 *
 * - counter = floor(epochSeconds / period)
 * - 결과는 항상 digits 자리로 0 패딩된 문자열
 * - 시각은 인자로 받는다. 내부에서 시계를 읽지 않으므로 테스트에서 시각을 고정할 수 있다.
 */
@Component
public class TotpCodeGenerator {

    public static final String ALGORITHM = "HmacSHA256";

    public String currentCode(byte[] secret, Instant timestamp, Duration period, int digits) {
        if (secret == null || secret.length == 0) throw new IllegalArgumentException("secret must not be empty");
        if (timestamp == null) throw new IllegalArgumentException("timestamp must not be null");

        try {
            TimeBasedOneTimePasswordGenerator totp = new TimeBasedOneTimePasswordGenerator(period, digits, ALGORITHM);
            int code = totp.generateOneTimePassword(new SecretKeySpec(secret, ALGORITHM), timestamp);
            return String.format(Locale.ROOT, "%0" + digits + "d", code);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TOTP computation failed", e);
        }
    }
}
