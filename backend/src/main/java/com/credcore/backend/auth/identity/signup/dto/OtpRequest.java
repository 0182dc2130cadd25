package com.credcore.backend.auth.identity.signup.dto;

import java.util.Map;

import com.credcore.backend.global.jackson.BlankToNullDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.NotBlank;

/**
 * OTP 발급 요청 (현재 지원 type: "sms")
 * - 가입되지 않은 전화번호면 임의 비밀번호로 가입부터 진행한다.
 */
public record OtpRequest(
        @NotBlank String type,

        @JsonDeserialize(using = BlankToNullDeserializer.class)
        String phone,

        @JsonDeserialize(using = BlankToNullDeserializer.class)
        String email,

        Map<String, Object> data
) {
    public static final String TYPE_SMS = "sms";
}
