package com.credcore.backend.auth.otp.support;

import java.security.SecureRandom;

import org.apache.commons.codec.binary.Base32;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import com.credcore.backend.auth.config.OtpProperties;

import lombok.RequiredArgsConstructor;

/**
 * TOTP 키 디스크립터(otpauth URL) 생성/해석
 *
 * otpauth://totp/{issuer}:{account}?secret=BASE32&issuer=..&algorithm=SHA256&digits=6&period=30
 *
 * - 이 URL 전체가 암호화되어 otp_secrets.payload에 저장된다.
 * - issuer는 app.otp.issuer, account는 전화번호(또는 이메일)
 */
@Component
@RequiredArgsConstructor
public class TotpKeyFactory {

    private static final int SECRET_BYTES = 20;
    private static final String SCHEME = "otpauth";
    private static final String TYPE = "totp";

    private final SecureRandom secureRandom;
    private final OtpProperties props;

    public String generate(String accountName) {
        if (!StringUtils.hasText(accountName)) {
            throw new IllegalArgumentException("accountName must not be blank");
        }

        byte[] secret = new byte[SECRET_BYTES];
        secureRandom.nextBytes(secret);
        String encoded = new Base32().encodeToString(secret);

        return UriComponentsBuilder.newInstance()
                .scheme(SCHEME)
                .host(TYPE)
                .path("/" + props.issuer() + ":" + accountName)
                .queryParam("secret", encoded)
                .queryParam("issuer", props.issuer())
                .queryParam("algorithm", "SHA256")
                .queryParam("digits", props.digits())
                .queryParam("period", props.periodSeconds())
                .encode()
                .build()
                .toUriString();
    }

    // 키 디스크립터에서 HMAC 시크릿 바이트를 꺼낸다.
    public byte[] secretOf(String keyUrl) {
        if (!StringUtils.hasText(keyUrl)) {
            throw new IllegalArgumentException("keyUrl must not be blank");
        }

        UriComponents uri = UriComponentsBuilder.fromUriString(keyUrl).build();
        if (!SCHEME.equals(uri.getScheme()) || !TYPE.equals(uri.getHost())) {
            throw new IllegalArgumentException("not a TOTP key descriptor");
        }

        String secret = uri.getQueryParams().getFirst("secret");
        if (!StringUtils.hasText(secret)) {
            throw new IllegalArgumentException("key descriptor has no secret");
        }
        return new Base32().decode(secret);
    }
}
