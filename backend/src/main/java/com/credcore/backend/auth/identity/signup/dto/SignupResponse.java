package com.credcore.backend.auth.identity.signup.dto;

import com.credcore.backend.auth.identity.login.dto.AccessGrant;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 가입/확인 응답
 * - 아직 확인이 남은 채널이 있으면 user만 내려간다.
 * - 모든 채널이 확인됐으면 access grant 필드가 함께 내려간다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SignupResponse(
        UserResponse user,
        String accessToken,
        String tokenType,
        Long expiresIn,
        String refreshToken
) {
    public static SignupResponse pending(UserResponse user) {
        return new SignupResponse(user, null, null, null, null);
    }

    public static SignupResponse granted(UserResponse user, AccessGrant grant) {
        return new SignupResponse(
                user,
                grant.accessToken(),
                grant.tokenType(),
                grant.expiresIn(),
                grant.refreshToken());
    }
}
