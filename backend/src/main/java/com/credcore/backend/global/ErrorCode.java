package com.credcore.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - code = enum name() (변경 시 API 계약 깨짐)
 * - status/message는 정책에 따라 바뀔 수 있지만, code는 최대한 고정한다.
 */
public enum ErrorCode {

    // Signup / identity
    SIGNUP_DISABLED(HttpStatus.FORBIDDEN,
            "현재 회원가입이 비활성화되어 있습니다."),
    EMAIL_ALREADY_REGISTERED(HttpStatus.CONFLICT,
            "이미 가입된 이메일입니다."),
    PHONE_ALREADY_REGISTERED(HttpStatus.CONFLICT,
            "이미 가입된 전화번호입니다."),

    // Signup input policy
    IDENTIFIER_REQUIRED(HttpStatus.BAD_REQUEST,
            "이메일 또는 전화번호 중 하나는 필수입니다."),
    INVALID_EMAIL_FORMAT(HttpStatus.BAD_REQUEST,
            "이메일 형식이 올바르지 않습니다."),
    INVALID_PHONE_FORMAT(HttpStatus.BAD_REQUEST,
            "전화번호는 E.164 형식(국가번호 포함, 숫자만)이어야 합니다."),
    PASSWORD_REQUIRED(HttpStatus.BAD_REQUEST,
            "비밀번호는 필수입니다."),
    WEAK_PASSWORD(HttpStatus.BAD_REQUEST,
            "비밀번호가 너무 짧습니다."),

    // OTP
    OTP_COOLDOWN(HttpStatus.TOO_MANY_REQUESTS,
            "잠시 후 다시 시도해주세요."),
    OTP_NOT_FOUND(HttpStatus.BAD_REQUEST,
            "인증 요청 이력이 없습니다. 먼저 인증번호를 요청해주세요."),
    OTP_EXPIRED(HttpStatus.BAD_REQUEST,
            "인증번호가 만료되었습니다. 다시 요청해주세요."),
    OTP_INVALID(HttpStatus.BAD_REQUEST,
            "인증번호가 올바르지 않습니다."),

    // Delivery
    DELIVERY_FAILED(HttpStatus.BAD_GATEWAY,
            "인증 메시지 발송에 실패했습니다. 잠시 후 다시 시도해주세요."),

    // Infra
    SECRET_CRYPTO_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다."), // 복호화 실패 원인은 외부로 노출하지 않는다
    PERSISTENCE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "일시적인 저장소 오류가 발생했습니다."),

    // Security
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "인증이 필요합니다."),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "요청 값이 올바르지 않습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
