package com.credcore.backend.auth.audit;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuditLogEntryRepository extends JpaRepository<AuditLogEntry, Long> {

    List<AuditLogEntry> findByTenantIdAndUserIdOrderByIdAsc(String tenantId, Long userId);
}
