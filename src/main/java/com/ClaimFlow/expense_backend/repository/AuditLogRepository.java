package com.ClaimFlow.expense_backend.repository;

import com.ClaimFlow.expense_backend.enums.AuditAction;
import com.ClaimFlow.expense_backend.model.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    @Query("""
        SELECT a FROM AuditLog a
        WHERE (:actorId IS NULL OR a.actorId = :actorId)
        AND (:action IS NULL OR a.action = :action)
        AND (:claimId IS NULL OR a.claimId = :claimId)
    """)
    Page<AuditLog> search(
            @Param("actorId") UUID actorId,
            @Param("action") AuditAction action,
            @Param("claimId") UUID claimId,
            Pageable pageable
    );

    List<AuditLog> findByClaimIdOrderByCreatedAtAsc(UUID claimId);
}
