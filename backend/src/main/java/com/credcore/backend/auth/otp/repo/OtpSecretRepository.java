package com.credcore.backend.auth.otp.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.credcore.backend.auth.otp.domain.OtpChannel;
import com.credcore.backend.auth.otp.domain.OtpSecret;

import jakarta.persistence.LockModeType;

@Repository
public interface OtpSecretRepository extends JpaRepository<OtpSecret, Long> {

    Optional<OtpSecret> findByUserIdAndTenantIdAndChannel(Long userId, String tenantId, OtpChannel channel);

    /**
     * Row-lock 조회 (대부분 DB에서 SELECT ... FOR UPDATE).
     *
     * 같은 (user, tenant, channel) 발급 요청을 트랜잭션 단위로 직렬화한다.
     * - 쿨다운 검사와 lastIssuedAt 갱신이 한 트랜잭션 안에서 원자적으로 일어난다.
     * - 늦게 온 요청은 먼저 온 요청이 커밋할 때까지 대기한 뒤, 갱신된 lastIssuedAt을 보고 쿨다운에 걸린다.
     *
     * 주의: row가 없으면 잠글 대상이 없다.
     * → 최초 생성 레이스는 (user_id, tenant_id, channel) UNIQUE 제약으로 막는다.
     *
     * @Transactional 안에서 호출되어야 락이 유지된다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from OtpSecret s where s.userId = :userId and s.tenantId = :tenantId and s.channel = :channel")
    Optional<OtpSecret> findForUpdate(
            @Param("userId") Long userId,
            @Param("tenantId") String tenantId,
            @Param("channel") OtpChannel channel);
}
