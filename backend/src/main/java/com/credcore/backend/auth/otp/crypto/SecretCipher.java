package com.credcore.backend.auth.otp.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

import com.credcore.backend.auth.config.CryptoProperties;

/**
 * OTP 시크릿 대칭 암복호화 (AES-256-GCM)
 *
 * 포맷: nonce(12) ‖ ciphertext ‖ tag(16)
 * - nonce는 매 호출마다 SecureRandom으로 새로 만든다(재사용 금지).
 * - 인증 실패(변조/다른 키)는 항상 SecretCipherException. 깨진 평문을 돌려주지 않는다.
 *
 * 키 유도:
 * - KEY_VERSION 1 = UTF-8 기준 정확히 32바이트 패스프레이즈를 그대로 AES 키로 쓴다.
 * - 다른 버전으로 저장된 row는 복호화하지 않고 거부한다.
 * - 패스프레이즈는 부팅 시 한 번만 바인딩한다. 없거나 32바이트가 아니면 부팅 실패(IllegalStateException).
 */
@Component
public class SecretCipher {

    public static final int KEY_VERSION = 1;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BYTES = 32;
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecretKey key;
    private final SecureRandom secureRandom;

    public SecretCipher(CryptoProperties props, SecureRandom secureRandom) {
        this.key = buildKey(props == null ? null : props.passphrase());
        this.secureRandom = secureRandom;
    }

    public int keyVersion() {
        return KEY_VERSION;
    }

    public byte[] encrypt(byte[] plaintext) {
        if (plaintext == null) throw new IllegalArgumentException("plaintext must not be null");

        byte[] nonce = new byte[NONCE_BYTES];
        secureRandom.nextBytes(nonce);

        try {
            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] body = c.doFinal(plaintext);

            byte[] out = new byte[NONCE_BYTES + body.length];
            System.arraycopy(nonce, 0, out, 0, NONCE_BYTES);
            System.arraycopy(body, 0, out, NONCE_BYTES, body.length);
            return out;
        } catch (GeneralSecurityException e) {
            throw new SecretCipherException("secret encryption failed", e);
        }
    }

    public byte[] decrypt(byte[] blob) {
        // nonce + 최소 tag 길이도 안 되면 GCM에 넘기지 않는다.
        if (blob == null || blob.length < NONCE_BYTES + TAG_BITS / 8) {
            throw new SecretCipherException("ciphertext too short");
        }

        byte[] nonce = Arrays.copyOfRange(blob, 0, NONCE_BYTES);

        try {
            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            return c.doFinal(blob, NONCE_BYTES, blob.length - NONCE_BYTES);
        } catch (GeneralSecurityException e) {
            // AEADBadTagException 포함
            throw new SecretCipherException("secret decryption failed", e);
        }
    }

    // 저장된 row의 키 버전까지 확인하는 복호화
    public byte[] decrypt(byte[] blob, int keyVersion) {
        if (keyVersion != KEY_VERSION) {
            throw new SecretCipherException("unsupported key version: " + keyVersion);
        }
        return decrypt(blob);
    }

    public byte[] encryptString(String plaintext) {
        if (plaintext == null) throw new IllegalArgumentException("plaintext must not be null");
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    public String decryptString(byte[] blob, int keyVersion) {
        return new String(decrypt(blob, keyVersion), StandardCharsets.UTF_8);
    }


    private static SecretKey buildKey(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalStateException("app.crypto.passphrase must be set");
        }

        byte[] bytes = passphrase.getBytes(StandardCharsets.UTF_8);
        if (bytes.length != KEY_BYTES) {
            throw new IllegalStateException("app.crypto.passphrase must be exactly " + KEY_BYTES + " bytes (UTF-8)");
        }

        return new SecretKeySpec(bytes, "AES");
    }
}
