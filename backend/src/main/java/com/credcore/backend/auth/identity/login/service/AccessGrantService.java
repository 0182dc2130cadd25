package com.credcore.backend.auth.identity.login.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.credcore.backend.auth.audit.AuditAction;
import com.credcore.backend.auth.audit.AuditLogService;
import com.credcore.backend.auth.config.AuthProperties;
import com.credcore.backend.auth.domain.User;
import com.credcore.backend.auth.hook.EventHookDispatcher;
import com.credcore.backend.auth.hook.HookKind;
import com.credcore.backend.auth.identity.login.dto.AccessGrant;
import com.credcore.backend.auth.repo.UserRepository;
import com.credcore.backend.auth.token.service.RefreshTokenService;
import com.credcore.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * access grant 발급 (가입 트랜잭션이 커밋된 "다음" 별도 트랜잭션)
 *
 * 한 트랜잭션 안에서:
 * 1) LOGIN 감사 로그
 * 2) LOGIN 훅
 * 3) lastSignInAt 갱신
 * 4) access token(JWT) + refresh token 발급
 *
 * 여기서 실패해도 이미 커밋된 가입/확인 결과는 되돌리지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessGrantService {

    private final UserRepository userRepository;
    private final AuditLogService auditLogService;
    private final EventHookDispatcher hooks;
    private final JwtService jwtService;
    private final RefreshTokenService refreshTokenService;
    private final AuthProperties authProps;
    private final Clock clock;

    @Transactional
    public Granted grant(String tenantId, Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new IllegalStateException("user vanished before grant: " + userId));

        if (!user.isFullyOnboarded()) {
            throw new IllegalStateException("access grant requires every registered channel to be confirmed");
        }

        LocalDateTime now = LocalDateTime.now(clock);

        auditLogService.record(tenantId, user, AuditAction.LOGIN);
        hooks.fire(HookKind.LOGIN, user, tenantId);
        user.markSignedIn(now);

        String accessToken = jwtService.issueAccessToken(user);
        RefreshTokenService.Issued refresh = refreshTokenService.issue(user.getId());

        log.info("access grant 발급: userId={}, tenant={}", user.getId(), tenantId);

        return new Granted(user, new AccessGrant(
                accessToken,
                AccessGrant.BEARER,
                authProps.jwt().accessTtlSeconds(),
                refresh.raw()));
    }

    public record Granted(User user, AccessGrant grant) {}
}
