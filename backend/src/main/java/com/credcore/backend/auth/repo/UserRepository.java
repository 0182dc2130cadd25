package com.credcore.backend.auth.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.credcore.backend.auth.domain.User;

/**
 * 모든 조회는 (tenantId, audience) 범위 안에서만 한다.
 * - 같은 이메일이라도 테넌트/오디언스가 다르면 다른 사용자다.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByTenantIdAndAudienceAndEmail(String tenantId, String audience, String email);

    Optional<User> findByTenantIdAndAudienceAndPhone(String tenantId, String audience, String phone);

    Optional<User> findByTenantIdAndAudienceAndEmailConfirmationToken(String tenantId, String audience, String token);
}
