package com.credcore.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 에러 응답 바디
 *
 * - code: ErrorCode.name(). 클라이언트는 이 값으로 분기한다.
 * - retryAfterSeconds: OTP_COOLDOWN일 때만. Retry-After 헤더와 같은 값.
 * - details: ApiException이 실어 보낸 추가 정보. 없으면 JSON에서 빠진다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,    // ex: "OTP_COOLDOWN"
        String message, // ex: "잠시 후 다시 시도해주세요."
        Integer retryAfterSeconds,
        Object details
) {
    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null, null);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), e.getRetryAfterSeconds(), e.getDetails());
    }
}
