package com.credcore.backend.auth.otp.service;

/**
 * 같은 (user, tenant, channel) 시크릿을 다른 트랜잭션이 방금 생성/갱신했음
 * - UNIQUE 충돌, @Version 충돌, 락 대기 실패
 * - 호출 측(오케스트레이터)은 이를 "방금 다른 요청이 발급함" = 쿨다운으로 응답한다.
 */
public class SecretConflictException extends RuntimeException {

    public SecretConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
