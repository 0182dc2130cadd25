package com.credcore.backend.auth.otp.crypto;

/**
 * HTTP와 분리된 "시크릿 암복호화 실패" 예외
 * - 인증 태그 불일치(변조/키 불일치), 너무 짧은 blob, 키 버전 불일치, 암호 엔진 초기화 실패
 * - 재시도하지 않는다. 데이터 손상 또는 키 설정 문제를 뜻한다.
 */
public class SecretCipherException extends RuntimeException {

    public SecretCipherException(String message) {
        super(message);
    }

    public SecretCipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
