package com.credcore.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.credcore.backend.auth.config.AuthProperties;
import com.credcore.backend.auth.token.domain.RefreshToken;
import com.credcore.backend.auth.token.repo.RefreshTokenRepository;
import com.credcore.backend.auth.token.support.TokenGenerator;
import com.credcore.backend.auth.token.support.TokenHashUtils;

import lombok.RequiredArgsConstructor;

/**
 * Refresh Token 발급
 *
 * - DB에는 refresh raw를 저장하지 않고 sha256(token_hash)만 저장한다.
 * - access grant 트랜잭션 안에서만 호출된다. grant가 롤백되면 refresh row도 같이 사라진다.
 */
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private final RefreshTokenRepository refreshTokenRepository;
    private final TokenGenerator tokenGenerator;
    private final AuthProperties props;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public Issued issue(Long userId) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plusSeconds(props.refresh().ttlSeconds());

        String raw = tokenGenerator.generateRefreshToken();
        String hash = TokenHashUtils.sha256Hex(raw);

        refreshTokenRepository.save(RefreshToken.issue(userId, hash, now, expiresAt));

        return new Issued(raw, expiresAt); // 원문은 응답으로만 내려간다.
    }

    public record Issued(String raw, LocalDateTime expiresAt) {}
}
