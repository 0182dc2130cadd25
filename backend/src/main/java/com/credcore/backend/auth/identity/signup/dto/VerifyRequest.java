package com.credcore.backend.auth.identity.signup.dto;

import com.credcore.backend.global.jackson.BlankToNullDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.NotBlank;

/**
 * 채널 확인 요청
 * - type=signup: 확인 메일 링크의 token
 * - type=sms: phone + SMS로 받은 코드(token)
 */
public record VerifyRequest(
        @NotBlank String type,

        @NotBlank
        @JsonDeserialize(using = BlankToNullDeserializer.class)
        String token,

        @JsonDeserialize(using = BlankToNullDeserializer.class)
        String phone
) {
    public static final String TYPE_SIGNUP = "signup";
    public static final String TYPE_SMS = "sms";
}
