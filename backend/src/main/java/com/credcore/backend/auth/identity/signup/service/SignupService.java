package com.credcore.backend.auth.identity.signup.service;

import java.util.Map;

import org.springframework.stereotype.Service;

import com.credcore.backend.auth.domain.User;
import com.credcore.backend.auth.identity.login.service.AccessGrantService;
import com.credcore.backend.auth.identity.signup.dto.SignupResponse;
import com.credcore.backend.auth.identity.signup.dto.UserResponse;
import com.credcore.backend.auth.otp.support.PhoneNumbers;
import com.credcore.backend.auth.token.support.TokenGenerator;
import com.credcore.backend.global.ApiException;
import com.credcore.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;

/**
 * 가입/확인 유스케이스 진입점 (트랜잭션을 직접 열지 않는다)
 *
 * 트랜잭션 경계:
 * - tx1: SignupRegistrar / ConfirmationService (사용자, 시크릿, 발송, 감사 로그)
 * - tx2: AccessGrantService (tx1 커밋 후, 모든 채널이 확인된 경우에만)
 *
 * tx2가 실패해도 tx1 결과는 유지된다. 클라이언트는 에러를 받고 다시 확인/로그인하면 된다.
 */
@Service
@RequiredArgsConstructor
public class SignupService {

    private final SignupRegistrar registrar;
    private final ConfirmationService confirmationService;
    private final AccessGrantService accessGrantService;
    private final TokenGenerator tokenGenerator;

    public SignupResponse signup(SignupContext ctx, String email, String phone, String password, Map<String, Object> data) {
        User user = registrar.register(ctx, email, phone, password, data);
        return respond(ctx, user);
    }

    /**
     * SMS OTP 요청
     * - 가입된 전화번호: 코드 재발급(쿨다운 적용)
     * - 처음 보는 전화번호: 임의 비밀번호(64자)로 가입 경로를 그대로 탄다.
     */
    public void requestSmsOtp(SignupContext ctx, String rawPhone, String email, Map<String, Object> data) {
        String phone = PhoneNumbers.normalize(rawPhone);
        if (!PhoneNumbers.isValidE164(phone)) {
            throw new ApiException(ErrorCode.INVALID_PHONE_FORMAT);
        }

        if (!registrar.issuePhoneCode(ctx, phone)) {
            signup(ctx, email, phone, tokenGenerator.generateRandomPassword(), data);
        }
    }

    public SignupResponse confirmEmail(SignupContext ctx, String token) {
        User user = confirmationService.confirmEmail(ctx, token);
        return respond(ctx, user);
    }

    public SignupResponse verifyPhone(SignupContext ctx, String phone, String code) {
        User user = confirmationService.verifyPhone(ctx, phone, code);
        return respond(ctx, user);
    }

    private SignupResponse respond(SignupContext ctx, User user) {
        if (!user.isFullyOnboarded()) {
            return SignupResponse.pending(UserResponse.from(user));
        }
        AccessGrantService.Granted granted = accessGrantService.grant(ctx.tenantId(), user.getId());
        return SignupResponse.granted(UserResponse.from(granted.user()), granted.grant());
    }
}
