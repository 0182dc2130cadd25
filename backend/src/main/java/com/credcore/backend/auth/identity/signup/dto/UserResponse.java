package com.credcore.backend.auth.identity.signup.dto;

import java.time.LocalDateTime;

import com.credcore.backend.auth.domain.AuthProvider;
import com.credcore.backend.auth.domain.User;
import com.credcore.backend.auth.domain.UserRole;
import com.credcore.backend.auth.domain.UserStatus;
import com.fasterxml.jackson.annotation.JsonRawValue;

/**
 * 사용자 응답 (확인 토큰/비밀번호 해시 등 비밀 값은 절대 포함하지 않는다)
 */
public record UserResponse(
        Long id,
        String aud,
        String email,
        String phone,
        UserRole role,
        UserStatus status,
        AuthProvider provider,
        @JsonRawValue String userMetaData,
        LocalDateTime confirmationSentAt,
        LocalDateTime emailConfirmedAt,
        LocalDateTime phoneConfirmedAt,
        LocalDateTime lastSignInAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getAudience(),
                user.getEmail(),
                user.getPhone(),
                user.getRole(),
                user.getStatus(),
                user.getProvider(),
                user.getUserMetaData(),
                user.getEmailConfirmationSentAt(),
                user.getEmailConfirmedAt(),
                user.getPhoneConfirmedAt(),
                user.getLastSignInAt(),
                user.getCreatedAt(),
                user.getUpdatedAt());
    }
}
