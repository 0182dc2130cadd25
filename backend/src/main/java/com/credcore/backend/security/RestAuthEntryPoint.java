package com.credcore.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import com.credcore.backend.global.ApiError;
import com.credcore.backend.global.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 공개 엔드포인트(/auth/signup, /auth/otp, /auth/verify, health) 밖으로 들어온 요청
 *
 * - 필터 체인에서 끝나므로 GlobalExceptionHandler를 거치지 않는다.
 *   같은 ApiError(AUTH_REQUIRED) 바디를 여기서 직접 쓴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        log.debug("[SECURITY] blocked {} {}", request.getMethod(), request.getRequestURI());

        ErrorCode code = ErrorCode.AUTH_REQUIRED;
        response.setStatus(code.status().value());
        response.setHeader("Cache-Control", "no-store");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), ApiError.of(code));
    }
}
