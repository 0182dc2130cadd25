package com.credcore.backend.auth.identity.signup.dto;

import java.util.Map;

import com.credcore.backend.global.jackson.BlankToNullDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Size;

/**
 * 회원가입 요청
 * - email/phone은 둘 중 하나 이상. 형식/필수 정책은 서비스에서 검증한다(에러 코드를 구분해야 하므로).
 * - data: 사용자 메타데이터(임의 JSON 객체)
 */
public record SignupRequest(

        @JsonDeserialize(using = BlankToNullDeserializer.class)
        @Size(max = 255, message = "이메일이 너무 깁니다.")
        String email,

        @JsonDeserialize(using = BlankToNullDeserializer.class)
        @Size(max = 32, message = "전화번호가 너무 깁니다.")
        String phone,

        @Size(max = 72, message = "비밀번호가 너무 깁니다.")
        String password,

        Map<String, Object> data
) {}
