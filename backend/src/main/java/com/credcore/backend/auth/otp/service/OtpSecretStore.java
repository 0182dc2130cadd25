package com.credcore.backend.auth.otp.service;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.credcore.backend.auth.otp.crypto.SecretCipher;
import com.credcore.backend.auth.otp.domain.OtpChannel;
import com.credcore.backend.auth.otp.domain.OtpSecret;
import com.credcore.backend.auth.otp.repo.OtpSecretRepository;
import com.credcore.backend.global.ApiException;
import com.credcore.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;

/**
 * 암호화된 OTP 시크릿 저장소
 *
 * - 조회 결과 없음은 Optional.empty() (= 아직 발급 전, 에러 아님)
 * - 모든 쓰기는 호출자의 트랜잭션 안에서 일어난다(MANDATORY).
 * - recordIssuance는 즉시 flush 한다. 저장 실패/버전 충돌은 외부 발송 전에 드러난다.
 */
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class OtpSecretStore {

    private final OtpSecretRepository repository;
    private final SecretCipher cipher;

    public Optional<OtpSecret> find(Long userId, String tenantId, OtpChannel channel) {
        return repository.findByUserIdAndTenantIdAndChannel(userId, tenantId, channel);
    }

    public Optional<OtpSecret> findForUpdate(Long userId, String tenantId, OtpChannel channel) {
        try {
            return repository.findForUpdate(userId, tenantId, channel);
        } catch (PessimisticLockingFailureException e) {
            throw new SecretConflictException("secret row is locked by another issuance", e);
        }
    }

    /**
     * 평문 키 디스크립터를 암호화해 새 row로 저장한다.
     * - 동시에 첫 발급이 두 번 들어오면 UNIQUE 제약이 단일 승자를 만든다. 패자는 SecretConflictException.
     */
    public OtpSecret create(Long userId, String tenantId, OtpChannel channel, String plaintext, LocalDateTime now) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new ApiException(ErrorCode.VALIDATION_ERROR, "OTP secret payload must not be blank");
        }

        byte[] payload = cipher.encryptString(plaintext);
        OtpSecret secret = OtpSecret.provision(userId, tenantId, channel, payload, cipher.keyVersion(), now);

        try {
            return repository.saveAndFlush(secret);
        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            throw new SecretConflictException("secret already provisioned by a concurrent request", e);
        }
    }

    public String decrypt(OtpSecret secret) {
        return cipher.decryptString(secret.getPayload(), secret.getKeyVersion());
    }

    // 반환값: 발급 전 상태
    public OtpSecret.IssuanceMark recordIssuance(OtpSecret secret, LocalDateTime at) {
        OtpSecret.IssuanceMark previous = secret.recordIssuance(at);
        try {
            repository.saveAndFlush(secret);
        } catch (OptimisticLockingFailureException e) {
            throw new SecretConflictException("secret was updated by a concurrent request", e);
        }
        return previous;
    }

    public void consume(OtpSecret secret, LocalDateTime now) {
        secret.consume(now);
        repository.saveAndFlush(secret);
    }
}
