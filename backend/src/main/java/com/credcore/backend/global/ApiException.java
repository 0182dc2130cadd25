package com.credcore.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 비즈니스 로직에서 사용하는 커스텀 예외 (중앙화된 ErrorCode 기반)
 *
 * - 서비스/도메인 정책 위반을 ErrorCode로 표현한다.
 * - 전역 핸들러(GlobalExceptionHandler)가 이 예외를 ApiError로 직렬화해 응답 포맷을 고정한다.
 *
 * 사용:
 *  throw new ApiException(ErrorCode.OTP_EXPIRED);
 *  throw new ApiException(ErrorCode.OTP_COOLDOWN, 42);   // Retry-After: 42
 *  throw new ApiException(ErrorCode.DELIVERY_FAILED, e); // 원인 예외 보존(로그용)
 */
@Getter
public class ApiException extends RuntimeException {

    private final HttpStatus status; // ex: HttpStatus.TOO_MANY_REQUESTS
    private final String code;       // ex: "OTP_COOLDOWN"
    private final Integer retryAfterSeconds;
    private final Object details;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, errorCode.defaultMessage(), null, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride) {
        this(errorCode, messageOverride, null, null);
    }

    public ApiException(ErrorCode errorCode, Integer retryAfterSeconds) {
        this(errorCode, errorCode.defaultMessage(), retryAfterSeconds, null);
    }

    public ApiException(ErrorCode errorCode, Throwable cause) {
        this(errorCode, errorCode.defaultMessage(), null, null);
        initCause(cause);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Integer retryAfterSeconds, Object details) {
        // super(...)는 첫 줄이어야 해서 errorCode null 검사보다 앞에 둘 수밖에 없음.
        super(resolveMessage(errorCode, messageOverride));

        if (errorCode == null)
            throw new IllegalArgumentException("ErrorCode must not be null");

        this.status = errorCode.status();
        this.code = errorCode.name();
        this.retryAfterSeconds = retryAfterSeconds;
        this.details = details;
    }

    private static String resolveMessage(ErrorCode errorCode, String messageOverride) {
        if (messageOverride != null && !messageOverride.isBlank()) {
            return messageOverride;
        }
        return (errorCode == null) ? null : errorCode.defaultMessage();
    }
}
