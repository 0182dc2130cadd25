package com.credcore.backend.auth.identity.signup.web;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.credcore.backend.auth.config.SignupProperties;
import com.credcore.backend.auth.identity.signup.dto.OtpRequest;
import com.credcore.backend.auth.identity.signup.dto.SignupRequest;
import com.credcore.backend.auth.identity.signup.dto.SignupResponse;
import com.credcore.backend.auth.identity.signup.dto.VerifyRequest;
import com.credcore.backend.auth.identity.signup.service.SignupContext;
import com.credcore.backend.auth.identity.signup.service.SignupService;
import com.credcore.backend.global.ApiException;
import com.credcore.backend.global.ErrorCode;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 가입/확인 API
 * - 요청 해석(@Valid) + 테넌트/오디언스 결정 + 서비스 호출만 담당
 * - X-Tenant-Id / X-Audience 헤더가 없으면 app.signup 기본값을 쓴다.
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthSignupController {

    static final String TENANT_HEADER = "X-Tenant-Id";
    static final String AUDIENCE_HEADER = "X-Audience";

    private static final int TENANT_MAX = 36;
    private static final int AUDIENCE_MAX = 100;

    private final SignupService signupService;
    private final SignupProperties signupProps;

    // 가입: 200 (확인이 남았으면 user만, 모두 확인됐으면 access grant 포함)
    @PostMapping("/signup")
    public ResponseEntity<SignupResponse> signup(
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(name = AUDIENCE_HEADER, required = false) String audience,
            @RequestBody @Valid SignupRequest req) {
        SignupContext ctx = context(tenantId, audience);
        return ResponseEntity.ok(signupService.signup(ctx, req.email(), req.phone(), req.password(), req.data()));
    }

    // OTP 요청: 200 {} (가입 여부와 무관하게 같은 응답)
    @PostMapping("/otp")
    public ResponseEntity<Map<String, String>> otp(
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(name = AUDIENCE_HEADER, required = false) String audience,
            @RequestBody @Valid OtpRequest req) {
        if (!OtpRequest.TYPE_SMS.equals(req.type())) {
            throw new ApiException(ErrorCode.VALIDATION_ERROR, "지원하지 않는 OTP 타입입니다.");
        }
        signupService.requestSmsOtp(context(tenantId, audience), req.phone(), req.email(), req.data());
        return ResponseEntity.ok(Map.of());
    }

    // 확인: 200 (이메일 링크 토큰 또는 SMS 코드)
    @PostMapping("/verify")
    public ResponseEntity<SignupResponse> verify(
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(name = AUDIENCE_HEADER, required = false) String audience,
            @RequestBody @Valid VerifyRequest req) {
        SignupContext ctx = context(tenantId, audience);
        return switch (req.type()) {
            case VerifyRequest.TYPE_SIGNUP -> ResponseEntity.ok(signupService.confirmEmail(ctx, req.token()));
            case VerifyRequest.TYPE_SMS -> ResponseEntity.ok(signupService.verifyPhone(ctx, req.phone(), req.token()));
            default -> throw new ApiException(ErrorCode.VALIDATION_ERROR, "지원하지 않는 확인 타입입니다.");
        };
    }

    private SignupContext context(String tenantId, String audience) {
        String t = isBlank(tenantId) ? signupProps.defaultTenantId() : tenantId.trim();
        String a = isBlank(audience) ? signupProps.defaultAudience() : audience.trim();
        if (t.length() > TENANT_MAX || a.length() > AUDIENCE_MAX) {
            throw new ApiException(ErrorCode.VALIDATION_ERROR, "테넌트/오디언스 헤더가 너무 깁니다.");
        }
        return new SignupContext(t, a);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
